package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleError(HttpServletRequest request) {
        Map<String, Object> errorDetails = new LinkedHashMap<>();

        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");

        // 容器会把业务异常包一层 ServletException
        Throwable cause = rootEngineCause(exception);
        int status = statusFor(cause, statusCode);

        errorDetails.put("status", status);
        HttpStatus resolved = HttpStatus.resolve(status);
        errorDetails.put("error", resolved != null ? resolved.getReasonPhrase() : "Error");
        errorDetails.put("message", cause != null && cause.getMessage() != null ? cause.getMessage()
                : errorMessage != null && !errorMessage.isEmpty() ? errorMessage : "An unexpected error occurred");

        if (cause != null) {
            errorDetails.put("exception", cause.getClass().getSimpleName());
        }

        if (status >= 500) log.error("Request failed: {}", errorDetails, exception);
        else log.warn("Request rejected: {}", errorDetails);

        return ResponseEntity.status(status).body(errorDetails);
    }

    static Throwable rootEngineCause(Throwable exception) {
        Throwable t = exception;
        while (t != null) {
            if (t instanceof BulletEngineException || t instanceof IllegalArgumentException) return t;
            if (t.getCause() == null || t.getCause() == t) break;
            t = t.getCause();
        }
        return t;
    }

    static int statusFor(Throwable cause, Integer statusCode) {
        if (cause instanceof BulletEngineException) return HttpStatus.UNPROCESSABLE_ENTITY.value();
        if (cause instanceof IllegalArgumentException) return HttpStatus.BAD_REQUEST.value();
        return statusCode != null ? statusCode : HttpStatus.INTERNAL_SERVER_ERROR.value();
    }
}

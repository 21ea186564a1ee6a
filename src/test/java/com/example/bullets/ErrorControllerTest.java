package com.example.bullets;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.ServletException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("ErrorController")
class ErrorControllerTest {

  private final ErrorController controller = new ErrorController();

  private static MockHttpServletRequest failed(int status, Throwable exception, String message) {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/error");
    request.setAttribute("jakarta.servlet.error.status_code", status);
    request.setAttribute("jakarta.servlet.error.exception", exception);
    request.setAttribute("jakarta.servlet.error.message", message);
    return request;
  }

  @Test
  @DisplayName("Should map a wrapped engine exception to 422")
  void shouldReturn422_whenEngineExceptionWrapped() {
    BulletSanitizationException cause = new BulletSanitizationException("Text has literal bullet prefix '•'", "• Did X");
    ServletException wrapped = new ServletException("Request processing failed", cause);

    ResponseEntity<Map<String, Object>> response = controller.handleError(failed(500, wrapped, null));

    assertThat(response.getStatusCode().value()).isEqualTo(422);
    assertThat(response.getBody())
        .containsEntry("status", 422)
        .containsEntry("error", "Unprocessable Entity")
        .containsEntry("message", "Text has literal bullet prefix '•': • Did X")
        .containsEntry("exception", "BulletSanitizationException");
  }

  @Test
  @DisplayName("Should map invalid arguments to 400")
  void shouldReturn400_whenIllegalArgument() {
    ServletException wrapped =
        new ServletException("Request processing failed", new IllegalArgumentException("items are required"));

    ResponseEntity<Map<String, Object>> response = controller.handleError(failed(500, wrapped, null));

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody()).containsEntry("message", "items are required");
  }

  @Test
  @DisplayName("Should keep the container status when nothing was thrown")
  void shouldPassThroughStatus_whenNoException() {
    ResponseEntity<Map<String, Object>> response = controller.handleError(failed(404, null, "Not Found"));

    assertThat(response.getStatusCode().value()).isEqualTo(404);
    assertThat(response.getBody())
        .containsEntry("error", "Not Found")
        .containsEntry("message", "Not Found")
        .doesNotContainKey("exception");
  }

  @Test
  @DisplayName("Should fall back to 500 for unknown failures")
  void shouldReturn500_whenUnexpectedException() {
    ResponseEntity<Map<String, Object>> response =
        controller.handleError(failed(500, new IllegalStateException("boom"), null));

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(ErrorController.statusFor(null, null)).isEqualTo(500);
  }
}

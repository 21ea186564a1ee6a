package com.example.bullets;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public BulletEngineConfig bulletEngineConfig() {
        return BulletEngineConfig.fromEnv();
    }

    /** 进程内共享，所有会话经同一把锁分配 */
    @Bean
    public NumIdAllocator numIdAllocator(BulletEngineConfig config) {
        return new NumIdAllocator(config);
    }
}

/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.automation.config;

import org.fireflyframework.automation.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.automation.persistence.ExecutionSerializer;
import org.fireflyframework.automation.persistence.redis.RedisPersistenceProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the Redis execution store.
 *
 * <p>Active when {@code firefly.automation.persistence.provider=redis}, Spring Data
 * Redis is on the classpath and a {@code ReactiveRedisTemplate} bean exists. Otherwise
 * the in-memory provider from {@link AutomationAutoConfiguration} is used.
 */
@Slf4j
@AutoConfiguration(before = AutomationAutoConfiguration.class,
        afterName = "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration")
public class AutomationPersistenceAutoConfiguration {

    @Configuration
    @ConditionalOnClass(name = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnBean(type = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnProperty(name = "firefly.automation.persistence.provider", havingValue = "redis")
    static class RedisPersistenceConfig {

        @Bean
        @ConditionalOnMissingBean(ExecutionPersistenceProvider.class)
        public ExecutionPersistenceProvider redisPersistenceProvider(
                org.springframework.data.redis.core.ReactiveRedisTemplate<String, String> redisTemplate,
                AutomationProperties properties) {
            log.info("[automation] Using Redis-based persistence provider");
            return new RedisPersistenceProvider(redisTemplate, new ExecutionSerializer(),
                    properties.getPersistence().getKeyPrefix(),
                    properties.getPersistence().getKeyTtl(),
                    properties.getEngine().getWriteConflictRetries());
        }
    }
}

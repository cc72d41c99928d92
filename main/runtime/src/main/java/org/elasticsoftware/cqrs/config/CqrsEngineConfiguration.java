/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.cqrs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.cqrs.annotations.DomainContext;
import org.elasticsoftware.cqrs.beans.DomainContextBeanScanner;
import org.elasticsoftware.cqrs.registry.HandlerRegistry;
import org.elasticsoftware.cqrs.registry.HandlerRegistryBuilder;
import org.elasticsoftware.cqrs.runtime.CqrsEngine;
import org.elasticsoftware.cqrs.runtime.EngineSettings;
import org.elasticsoftware.cqrs.runtime.UnmatchedTypePolicy;
import org.elasticsoftware.cqrs.serialization.CloudEventsModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@PropertySource("classpath:cqrs-engine.properties")
public class CqrsEngineConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CqrsEngineConfiguration.class);

    @Bean(name = "cqrsEngineObjectMapper")
    public ObjectMapper cqrsEngineObjectMapper() {
        return new ObjectMapper().registerModule(new CloudEventsModule());
    }

    @Bean(name = "cqrsEngineSettings")
    public EngineSettings engineSettings(@Value("${cqrs.engine.source}") String source,
                                         @Value("${cqrs.engine.unknown-command-policy}") UnmatchedTypePolicy unknownCommandPolicy,
                                         @Value("${cqrs.engine.unmatched-event-policy}") UnmatchedTypePolicy unmatchedEventPolicy) {
        logger.info("Using source {}, unknown command policy {}, unmatched event policy {}",
                source, unknownCommandPolicy, unmatchedEventPolicy);
        return new EngineSettings(source, unknownCommandPolicy, unmatchedEventPolicy);
    }

    @Bean(name = "cqrsEngineHandlerRegistry")
    public HandlerRegistry handlerRegistry(ApplicationContext applicationContext,
                                           ObjectProvider<HandlerRegistryCustomizer> customizers) {
        HandlerRegistryBuilder builder = HandlerRegistry.builder();
        DomainContextBeanScanner scanner = new DomainContextBeanScanner();
        applicationContext.getBeansWithAnnotation(DomainContext.class)
                .forEach((beanName, bean) -> scanner.scan(beanName, bean, builder));
        customizers.orderedStream().forEach(customizer -> customizer.customize(builder));
        return builder.build();
    }

    @Bean(name = "cqrsEngine")
    public CqrsEngine cqrsEngine(@Qualifier("cqrsEngineHandlerRegistry") HandlerRegistry handlerRegistry,
                                 @Qualifier("cqrsEngineSettings") EngineSettings engineSettings,
                                 @Qualifier("cqrsEngineObjectMapper") ObjectMapper objectMapper) {
        return new CqrsEngine(handlerRegistry, engineSettings, objectMapper);
    }
}

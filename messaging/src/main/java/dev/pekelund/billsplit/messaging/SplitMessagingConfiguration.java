package dev.pekelund.billsplit.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.pekelund.billsplit.config.BillSplitConfiguration;
import dev.pekelund.billsplit.settlement.BillSplitEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(BillSplitConfiguration.class)
@EnableConfigurationProperties(SplitMessagingProperties.class)
public class SplitMessagingConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper splitObjectMapper() {
        return JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SplitMessageMapper splitMessageMapper(SplitMessagingProperties properties) {
        return new SplitMessageMapper(properties.getEveryoneLabel());
    }

    @Bean
    @ConditionalOnMissingBean
    public SplitRequestHandler splitRequestHandler(BillSplitEngine billSplitEngine,
        SplitMessageMapper splitMessageMapper, ObjectMapper objectMapper) {
        return new SplitRequestHandler(billSplitEngine, splitMessageMapper, objectMapper);
    }
}

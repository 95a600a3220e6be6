package com.marketchat.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer chatJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer serializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, serializer);
            builder.serializerByType(Long.TYPE, serializer);
            // Instant 输出 ISO-8601 字符串（与客户端 toISOString 对齐），而不是数字时间戳
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            // 客户端可能多带字段（旧版本/调试字段），不因此拒绝整帧
            builder.featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        };
    }
}

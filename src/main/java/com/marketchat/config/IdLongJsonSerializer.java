package com.marketchat.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;

/**
 * 雪花 id 超过 JS Number 安全范围：名字以 {@code id}/{@code Id} 结尾的 long 字段按字符串输出。
 *
 * <p>计数类字段（unreadCount、total、msgSeq ...）保持数字。</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (asString) {
            gen.writeString(Long.toString(value));
        } else {
            gen.writeNumber(value);
        }
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) {
        if (property == null) {
            return this;
        }
        return new IdLongJsonSerializer(isIdFieldName(property.getName()));
    }

    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return "id".equals(lower) || lower.endsWith("id");
    }
}

package com.example.chatty.gateway.channel;

import com.example.chatty.shared.dto.FieldViolation;
import com.example.chatty.shared.exception.GatewayException;

import java.util.regex.Pattern;

/**
 * Topic names double as backbone channel suffixes, so pattern characters are not allowed.
 */
public final class Topics {

    private static final Pattern VALID_TOPIC = Pattern.compile("[A-Za-z0-9:_.-]{1,128}");

    private Topics() {}

    public static boolean isValid(String topic) {
        return topic != null && VALID_TOPIC.matcher(topic).matches();
    }

    public static String requireValid(String topic) {
        if (!isValid(topic)) {
            throw GatewayException.validation("Invalid topic",
                    new FieldViolation("topic", "must be 1-128 characters of letters, digits, ':', '_', '.' or '-'"));
        }
        return topic;
    }
}

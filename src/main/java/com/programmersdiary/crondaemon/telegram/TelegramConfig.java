package com.programmersdiary.crondaemon.telegram;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class TelegramConfig {

    private final boolean enabled;
    private final String token;
    private final Set<Long> allowedUsers;

    public TelegramConfig(
            @Value("${crondaemon.telegram.enabled:false}") boolean enabled,
            @Value("${crondaemon.telegram.token:}") String token,
            @Value("${crondaemon.telegram.allowed-users:}") String allowedUsers) {
        this.enabled = enabled;
        this.token = token != null ? token.strip() : "";
        this.allowedUsers = parseUsers(allowedUsers);
    }

    public boolean enabled() {
        return enabled;
    }

    public String token() {
        return token;
    }

    /**
     * Empty when everyone may talk to the bot.
     */
    public Set<Long> allowedUsers() {
        return allowedUsers;
    }

    public boolean isAllowed(long userId) {
        return allowedUsers.isEmpty() || allowedUsers.contains(userId);
    }

    private static Set<Long> parseUsers(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        try {
            return Arrays.stream(value.split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .map(Long::valueOf)
                    .collect(Collectors.toUnmodifiableSet());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("crondaemon.telegram.allowed-users must be numeric ids: " + value, e);
        }
    }
}

package com.authplatform.authsvc.infra.oauth;

import com.authplatform.authsvc.domain.port.OAuthProfile;
import com.authplatform.authsvc.domain.port.ProviderTokens;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps a provider's user-info payload onto {@link OAuthProfile}.
 */
@FunctionalInterface
public interface ProfileMapper {

    OAuthProfile map(JsonNode userInfo, ProviderTokens tokens);

    /**
     * Field names most providers share: {@code id} or {@code sub}, {@code email}, {@code name},
     * {@code picture} or {@code avatar_url}.
     */
    static ProfileMapper standard() {
        return (userInfo, tokens) -> new OAuthProfile(
                text(userInfo, "id", "sub"),
                text(userInfo, "email"),
                text(userInfo, "name"),
                text(userInfo, "picture", "avatar_url"),
                tokens);
    }

    /**
     * First non-blank value among the named fields; numbers are rendered as text.
     */
    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }
}

package com.authplatform.authsvc.infra.oauth;

import com.authplatform.authsvc.domain.port.OAuthProfile;

import java.util.Locale;
import java.util.Optional;

/**
 * Endpoints, scopes and profile mapping of well-known providers.
 */
public enum ProviderPreset {

    GOOGLE("https://accounts.google.com/o/oauth2/v2/auth",
            "https://oauth2.googleapis.com/token",
            "https://www.googleapis.com/oauth2/v2/userinfo",
            "openid email profile",
            ProfileMapper.standard()),

    GITHUB("https://github.com/login/oauth/authorize",
            "https://github.com/login/oauth/access_token",
            "https://api.github.com/user",
            "read:user user:email",
            (userInfo, tokens) -> new OAuthProfile(
                    ProfileMapper.text(userInfo, "id"),
                    ProfileMapper.text(userInfo, "email"),
                    ProfileMapper.text(userInfo, "name", "login"),
                    ProfileMapper.text(userInfo, "avatar_url"),
                    tokens)),

    FACEBOOK("https://www.facebook.com/v18.0/dialog/oauth",
            "https://graph.facebook.com/v18.0/oauth/access_token",
            "https://graph.facebook.com/me?fields=id,name,email,picture",
            "email public_profile",
            (userInfo, tokens) -> new OAuthProfile(
                    ProfileMapper.text(userInfo, "id"),
                    ProfileMapper.text(userInfo, "email"),
                    ProfileMapper.text(userInfo, "name"),
                    ProfileMapper.text(userInfo.path("picture").path("data"), "url"),
                    tokens)),

    MICROSOFT("https://login.microsoftonline.com/{tenant}/oauth2/v2.0/authorize",
            "https://login.microsoftonline.com/{tenant}/oauth2/v2.0/token",
            "https://graph.microsoft.com/v1.0/me",
            "openid email profile User.Read",
            (userInfo, tokens) -> new OAuthProfile(
                    ProfileMapper.text(userInfo, "id"),
                    ProfileMapper.text(userInfo, "mail", "userPrincipalName"),
                    ProfileMapper.text(userInfo, "displayName"),
                    null,
                    tokens));

    public static final String DEFAULT_TENANT = "common";

    private final String authorizationUri;
    private final String tokenUri;
    private final String userInfoUri;
    private final String scope;
    private final ProfileMapper profileMapper;

    ProviderPreset(String authorizationUri, String tokenUri, String userInfoUri, String scope,
                   ProfileMapper profileMapper) {
        this.authorizationUri = authorizationUri;
        this.tokenUri = tokenUri;
        this.userInfoUri = userInfoUri;
        this.scope = scope;
        this.profileMapper = profileMapper;
    }

    /**
     * Settings for this preset. {@code tenant} only matters for Microsoft and defaults to
     * {@value #DEFAULT_TENANT}.
     */
    public OAuth2ProviderSettings.OAuth2ProviderSettingsBuilder settings(String id, String clientId,
                                                                        String clientSecret, String tenant) {
        String resolvedTenant = tenant == null || tenant.isBlank() ? DEFAULT_TENANT : tenant;
        return OAuth2ProviderSettings.builder()
                .id(id)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .authorizationUri(authorizationUri.replace("{tenant}", resolvedTenant))
                .tokenUri(tokenUri.replace("{tenant}", resolvedTenant))
                .userInfoUri(userInfoUri)
                .scope(scope);
    }

    public ProfileMapper profileMapper() {
        return profileMapper;
    }

    public static Optional<ProviderPreset> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.authplatform.authsvc.property;

import com.authplatform.authsvc.shared.exception.ValidationException;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import com.authplatform.authsvc.shared.validation.ValidationService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Tag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for input validation and log masking.
 */
@Tag("Feature: auth-service, Property: Input Validation")
class InputValidationPropertyTest {

    private final ValidationService validationService = new ValidationService();
    private final SecurityUtils securityUtils = new SecurityUtils();

    @Property(tries = 100)
    @Label("well-formed emails pass registration validation")
    void validEmailsPass(@ForAll("localParts") String localPart, @ForAll("domains") String domain) {
        var result = validationService.validateRegistration(localPart + "@" + domain, "secret", null);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Property(tries = 50)
    @Label("malformed emails are reported against the email field")
    void malformedEmailsFail(@ForAll("malformedEmails") String email) {
        var result = validationService.validateRegistration(email, "secret", null);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).anyMatch(e -> e.field().equals("email"));
    }

    @Property(tries = 100)
    @Label("normalization trims and lowercases")
    void normalizationIsIdempotent(@ForAll("localParts") String localPart, @ForAll("domains") String domain) {
        String raw = "  " + localPart.toUpperCase() + "@" + domain.toUpperCase() + " ";
        String normalized = validationService.normalizeEmail(raw);

        assertThat(normalized).isEqualTo(localPart + "@" + domain);
        assertThat(validationService.normalizeEmail(normalized)).isEqualTo(normalized);
    }

    @Property(tries = 50)
    @Label("display names longer than 100 characters are rejected")
    void longDisplayNamesFail(@ForAll @StringLength(min = 101, max = 300) @AlphaChars String name) {
        var result = validationService.validateRegistration("alice@example.com", "secret", name);

        assertThat(result.errors()).anyMatch(e -> e.code().equals("TOO_LONG"));
    }

    @Example
    @Label("every blank required field is reported at once")
    void requireAllCollectsEveryMissingField() {
        assertThatThrownBy(() -> validationService.requireAll("email", " ", "password", null, "token", "t"))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors())
                        .extracting(f -> f.field())
                        .containsExactly("email", "password"));
    }

    @Example
    @Label("display names are stored as typed and blank names dropped")
    void normalizeDisplayName() {
        assertThat(validationService.normalizeDisplayName(" <b>Alice</b> ")).isEqualTo("<b>Alice</b>");
        assertThat(validationService.normalizeDisplayName("   ")).isNull();
    }

    @Property(tries = 100)
    @Label("normalized display names never exceed the stored length")
    void normalizedDisplayNamesFitTheColumn(@ForAll @StringLength(max = 400) String name) {
        String normalized = validationService.normalizeDisplayName(name);

        if (normalized != null) {
            assertThat(normalized.length()).isLessThanOrEqualTo(ValidationService.DISPLAY_NAME_MAX_LENGTH);
            assertThat(normalized.codePoints().count()).isLessThanOrEqualTo(ValidationService.DISPLAY_NAME_MAX_LENGTH);
            assertThat(name).contains(normalized);
        }
    }

    @Example
    @Label("a surrogate pair at the cut is dropped whole")
    void truncationKeepsSurrogatePairsIntact() {
        String name = "a".repeat(99) + "\uD83D\uDE00tail";

        assertThat(validationService.normalizeDisplayName(name)).isEqualTo("a".repeat(99));
    }

    @Example
    @Label("avatar URLs longer than the stored length are dropped")
    void normalizeImageUrl() {
        assertThat(validationService.normalizeImageUrl(" https://cdn.example.com/a.png "))
                .isEqualTo("https://cdn.example.com/a.png");
        assertThat(validationService.normalizeImageUrl("https://cdn.example.com/" + "x".repeat(3000))).isNull();
        assertThat(validationService.normalizeImageUrl("")).isNull();
    }

    @Property(tries = 100)
    @Label("masked IPv4 hides the last octet")
    void ipMasking(@ForAll @IntRange(max = 255) int o1, @ForAll @IntRange(max = 255) int o2,
                   @ForAll @IntRange(max = 255) int o3, @ForAll @IntRange(max = 255) int o4) {
        String masked = securityUtils.maskIp(o1 + "." + o2 + "." + o3 + "." + o4);

        assertThat(masked).isEqualTo(o1 + "." + o2 + "." + o3 + ".***");
    }

    @Property(tries = 100)
    @Label("masked email keeps two characters and the domain")
    void emailMasking(@ForAll("localParts") String localPart, @ForAll("domains") String domain) {
        String masked = securityUtils.maskEmail(localPart + "@" + domain);

        assertThat(masked).isEqualTo(localPart.substring(0, 2) + "***@" + domain);
    }

    @Example
    @Label("bearer tokens are extracted case-insensitively")
    void bearerExtraction() {
        assertThat(securityUtils.extractBearerToken("Bearer abc")).isEqualTo("abc");
        assertThat(securityUtils.extractBearerToken("bearer abc ")).isEqualTo("abc");
        assertThat(securityUtils.extractBearerToken("Basic abc")).isNull();
        assertThat(securityUtils.extractBearerToken("Bearer ")).isNull();
        assertThat(securityUtils.extractBearerToken(null)).isNull();
    }

    @Provide
    Arbitrary<String> localParts() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(3).ofMaxLength(15);
    }

    @Provide
    Arbitrary<String> domains() {
        return Arbitraries.of("example.com", "test.org", "company.net", "mail.io");
    }

    @Provide
    Arbitrary<String> malformedEmails() {
        return Arbitraries.of("invalid", "no@domain", "@nodomain.com", "spaces in@email.com", "a@b.c", "   ");
    }
}

package com.shopnest.authservice.SecurityConfig;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenExtractorTest {

    @Test
    void extractsToken() {
        assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
    }

    @Test
    void schemeIsCaseInsensitive() {
        assertThat(BearerTokenExtractor.extract("bearer abc")).contains("abc");
        assertThat(BearerTokenExtractor.extract("  BEARER   abc  ")).contains("abc");
    }

    @Test
    void rejectsMissingOrMalformedHeaders() {
        assertThat(BearerTokenExtractor.extract(null)).isEmpty();
        assertThat(BearerTokenExtractor.extract("")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearerabc")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer two tokens")).isEmpty();
    }
}

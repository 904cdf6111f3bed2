package com.example.securechat.web;

import com.example.securechat.error.MissingOwnerException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnerIdResolverTest {

    private final OwnerIdResolver resolver = new OwnerIdResolver();

    @Test
    void headerValueIsTrimmed() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader(OwnerIdResolver.HEADER_NAME, "  user-42 ");

        assertThat(resolver.resolveOwnerId(req)).isEqualTo("user-42");
    }

    @Test
    void missingOrBlankHeaderIsRejected() {
        MockHttpServletRequest blank = new MockHttpServletRequest();
        blank.addHeader(OwnerIdResolver.HEADER_NAME, "   ");

        assertThatThrownBy(() -> resolver.resolveOwnerId(new MockHttpServletRequest()))
                .isInstanceOf(MissingOwnerException.class);
        assertThatThrownBy(() -> resolver.resolveOwnerId(blank))
                .isInstanceOf(MissingOwnerException.class);
    }

    @Test
    void overlongHeaderIsRejected() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader(OwnerIdResolver.HEADER_NAME, "u".repeat(129));

        assertThatThrownBy(() -> resolver.resolveOwnerId(req)).isInstanceOf(MissingOwnerException.class);
    }
}

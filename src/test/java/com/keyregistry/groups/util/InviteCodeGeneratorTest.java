package com.keyregistry.groups.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InviteCodeGeneratorTest {

    @Test
    void generate_ProducesValidInviteCodes() {
        for (int i = 0; i < 50; i++) {
            String code = InviteCodeGenerator.generate();
            assertThat(code).hasSize(12).matches("[A-Za-z0-9]+");
            assertThatCode(() -> GroupValidationRules.validateInviteCode(code)).doesNotThrowAnyException();
        }
    }

    @Test
    void generate_AvoidsLookAlikeCharacters() {
        for (int i = 0; i < 50; i++) {
            assertThat(InviteCodeGenerator.generate()).doesNotContain("0", "O", "1", "l", "I");
        }
    }

    @Test
    void generate_ProducesDistinctCodes() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            codes.add(InviteCodeGenerator.generate());
        }
        assertThat(codes).hasSize(100);
    }

    @Test
    void generateUnique_RetriesUntilCheckerReportsFree() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        String code = InviteCodeGenerator.generateUnique(candidate -> calls.incrementAndGet() < 3);

        // Then
        assertThat(code).hasSize(12);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void generateUnique_WhenEverythingTaken_Throws() {
        assertThatThrownBy(() -> InviteCodeGenerator.generateUnique(candidate -> true))
            .isInstanceOf(IllegalStateException.class);
    }
}

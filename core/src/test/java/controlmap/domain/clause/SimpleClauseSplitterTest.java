package controlmap.domain.clause;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimpleClauseSplitterTest {

    private final ClauseSplitter clauseSplitter = new SimpleClauseSplitter();

    @Test
    void testSplitPolicy() {
        final String document = """
                Access Control Policy

                1. All users must authenticate with multi-factor authentication.
                2.1 Access rights are reviewed every quarter by system owners.
                a. Privileged accounts are approved by the security team.
                • Passwords must be rotated every ninety days.
                - Shared accounts are prohibited unless approved in writing.
                Logs are retained for one year. Security events are reviewed daily! Is encryption required? Yes.
                Short line.""";

        assertEquals(List.of(
                "Access Control Policy",
                "All users must authenticate with multi-factor authentication.",
                "Access rights are reviewed every quarter by system owners.",
                "Privileged accounts are approved by the security team.",
                "Passwords must be rotated every ninety days.",
                "Shared accounts are prohibited unless approved in writing.",
                "Logs are retained for one year.",
                "Security events are reviewed daily!",
                "Is encryption required?"), clauseSplitter.split(document));
    }

    @Test
    void testNumberedMarkerWithTrailingDot() {
        assertEquals(List.of(
                        "Incidents are reported within one hour.",
                        "Incidents are reviewed by the response team."),
                clauseSplitter.split("Incidents are reported within one hour.\n3.2. Incidents are reviewed by the response team."));
    }

    @Test
    void testHyphenatedWordsAreNotSplit() {
        assertEquals(List.of("Third-party vendors undergo a security review before onboarding."),
                clauseSplitter.split("Third-party vendors undergo a security review before onboarding."));
    }

    @Test
    void testWindowsLineEndings() {
        assertEquals(List.of(
                        "Backups are tested every month.",
                        "Restores are documented by the operator."),
                clauseSplitter.split("Backups are tested every month.\r\n\r\nRestores are documented by the operator."));
    }

    @Test
    void testBlankDocument() {
        assertTrue(clauseSplitter.split("").isEmpty());
        assertTrue(clauseSplitter.split("  \n ").isEmpty());
    }
}

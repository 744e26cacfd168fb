package com.pizhai.render.compliance;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class MarkupComplianceGateTest {

    private final MarkupComplianceGate gate = new MarkupComplianceGate();

    @Test
    public void cleanMarkupScoresFull() {
        ComplianceResult result = gate.check(ComplianceCheck.forRender("screenshot_generation",
                "<html><head><meta name=\"x\" content=\"y\"></head><body>ok</body></html>"));

        assertThat(result.isCompliant()).isTrue();
        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getViolations()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    public void scriptTagsAndEventHandlersAreRejected() {
        String[] unsafe = {
                "<SCRIPT>alert(1)</SCRIPT>",
                "<a href=\"javascript:void(0)\">x</a>",
                "<img src=x onerror = \"alert(1)\">",
                "<iframe src=\"https://example.com\"></iframe>"
        };
        for (String markup : unsafe) {
            ComplianceResult result = gate.check(ComplianceCheck.forRender("pdf_generation", markup));

            assertThat(result.isCompliant()).as(markup).isFalse();
            assertThat(result.getViolations()).as(markup).hasSize(1);
            assertThat(result.getScore()).isCloseTo(0.9, within(1e-9));
        }
    }

    @Test
    public void onlyTheLeadingCharactersAreInspected() {
        StringBuilder markup = new StringBuilder();
        while (markup.length() < MarkupComplianceGate.INSPECTED_PREFIX) {
            markup.append("<p>text</p>");
        }
        markup.append("<script>alert(1)</script>");

        ComplianceResult result = gate.check(ComplianceCheck.forRender("screenshot_generation", markup.toString()));

        assertThat(result.isCompliant()).isTrue();
    }

    @Test
    public void missingActionIsOnlyAWarning() {
        ComplianceResult result = gate.check(ComplianceCheck.forRender(null, "<p>ok</p>"));

        assertThat(result.isCompliant()).isTrue();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getScore()).isCloseTo(0.999, within(1e-9));
    }

    @Test
    public void skippingAuditAndMissingActionAreWarnings() {
        ComplianceResult result = gate.check(ComplianceCheck.builder()
                .markup("<p>ok</p>")
                .skipAudit(true)
                .build());

        assertThat(result.getViolations()).isEmpty();
        assertThat(result.getScore()).isCloseTo(0.997, within(1e-9));
        assertThat(result.getWarnings()).hasSize(2);
    }

    @Test
    public void placeholderDataIsAViolation() {
        ComplianceResult result = gate.check(ComplianceCheck.builder()
                .action("screenshot_generation")
                .markup("<p>lorem ipsum</p>")
                .realData(false)
                .build());

        assertThat(result.isCompliant()).isFalse();
        assertThat(result.getScore()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    public void minimumScoreIsConfigurable() {
        MarkupComplianceGate strict = new MarkupComplianceGate(1.0);

        ComplianceResult result = strict.check(ComplianceCheck.forRender("", "<p>ok</p>"));

        assertThat(result.getViolations()).isEmpty();
        assertThat(result.isCompliant()).isFalse();
    }

    @Test
    public void permitAllAcceptsAnything() {
        ComplianceResult result = ComplianceGate.permitAll()
                .check(ComplianceCheck.forRender("pdf_generation", "<script>x</script>"));

        assertThat(result.isCompliant()).isTrue();
        assertThat(result.getScore()).isEqualTo(1.0);
    }
}

package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;
import org.netpreserve.scriptorium.config.TrustConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrustPolicyTest {
    private final TrustPolicy policy = new TrustPolicy(TestConfigs.trust(false, false));

    @Test
    public void trustedHostIsAllowed() {
        var verdict = policy.isTrusted("https://trusted.example/paper.pdf");
        assertTrue(verdict.allowed());
        assertEquals("trusted", verdict.reason());
        assertEquals("trusted.example", verdict.host());
    }

    @Test
    public void hostsMatchExactly() {
        assertEquals("untrusted-host", policy.isTrusted("https://www.trusted.example/a.pdf").reason());
        assertEquals("untrusted-host", policy.isTrusted("https://example/a.pdf").reason());
        assertEquals("untrusted-host", policy.isTrusted("https://trusted.example.evil.com/a.pdf").reason());
    }

    @Test
    public void hostComparisonIgnoresCaseAndTrailingDot() {
        assertTrue(policy.isTrusted("https://TRUSTED.Example./a.pdf").allowed());
    }

    @Test
    public void malformedUrlsAreRejectedNotThrown() {
        assertEquals("unparseable-url", policy.isTrusted("not a url").reason());
        assertEquals("unparseable-url", policy.isTrusted("http://[broken/").reason());
        assertEquals("unparseable-url", policy.isTrusted((String) null).reason());
        assertFalse(policy.test(null));
    }

    @Test
    public void onlyHttpSchemes() {
        var verdict = policy.isTrusted("ftp://trusted.example/a.pdf");
        assertFalse(verdict.allowed());
        assertEquals("unsupported-scheme", verdict.reason());
    }

    @Test
    public void assumptionsMustBeAccepted() {
        assertEquals("scan-only-not-accepted", policy.isTrusted("https://scans.example/a.djvu").reason());
        assertEquals("licensed-not-accepted", policy.isTrusted("https://licensed.example/a.pdf").reason());

        var permissive = new TrustPolicy(TestConfigs.trust(true, true));
        assertTrue(permissive.isTrusted("https://scans.example/a.djvu").allowed());
        assertTrue(permissive.isTrusted("https://licensed.example/a.pdf").allowed());
        assertTrue(permissive.acceptsScanOnly());
    }

    @Test
    public void laterEntriesOverrideEarlierOnes() {
        var config = new TrustConfig(false, false, List.of(
                new TrustedHost("archive.example", false, true),
                TrustedHost.of("archive.example")));
        assertTrue(new TrustPolicy(config).isTrusted("https://archive.example/x").allowed());
    }
}

package me.golemcore.gurgeh.domain.service;

import me.golemcore.gurgeh.testsupport.SandboxFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PublicSiteServiceTest {

    @TempDir
    Path tempDir;

    private SandboxFixture fixture;
    private PublicSiteService site;

    @BeforeEach
    void setUp() {
        fixture = SandboxFixture.create(tempDir);
        fixture.fileService().initDirectories();
        site = newService(fixture.clock());
        site.initialize();
    }

    private PublicSiteService newService(Clock clock) {
        return new PublicSiteService(fixture.fileService(), fixture.sandbox(), new DisclosureInjector(), clock);
    }

    @Test
    void shouldPersistPageViewsAcrossRestarts() {
        site.recordPageView();
        site.recordPageView();

        assertEquals("2", fixture.readPhysical(PublicSiteService.PAGE_VIEWS_PATH));

        PublicSiteService restarted = newService(fixture.clock());
        restarted.initialize();
        assertEquals(2L, restarted.getPageViews());
        assertEquals(3L, restarted.recordPageView());
    }

    @Test
    void shouldStartFromZeroWhenCounterFileIsMalformed() {
        fixture.writePhysical(PublicSiteService.PAGE_VIEWS_PATH, "lots");

        PublicSiteService restarted = newService(fixture.clock());
        restarted.initialize();

        assertEquals(0L, restarted.getPageViews());
    }

    @Test
    void shouldMeasureUptimeFromConstruction() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(SandboxFixture.FIXED_NOW, SandboxFixture.FIXED_NOW.plusSeconds(125));

        PublicSiteService timed = newService(clock);

        assertEquals(Duration.ofSeconds(125), timed.getUptime());
    }

    @Test
    void shouldServePublishedLandingPage() {
        fixture.writePhysical("/public/index.html", "<h1>Garden</h1>");

        assertEquals("<h1>Garden</h1>", site.landingPage());
    }

    @Test
    void shouldFallBackToPlaceholderWithoutLandingPage() throws IOException {
        Files.delete(fixture.physical("/public/index.html"));

        assertEquals(PublicSiteService.INITIALISING_HTML, site.landingPage());
    }

    @Test
    void shouldDiscloseAuthorshipOnDonationPage() {
        String page = site.donationPage();

        assertTrue(page.contains("Support This Entity"));
        assertTrue(page.contains(DisclosureInjector.DISCLOSURE_TEXT));
        assertTrue(page.contains("content=\"" + DisclosureInjector.GENERATOR_ID + "\""));
    }

    @Test
    void shouldFindFileBelowPublicDirectory() {
        fixture.writePhysical("/public/css/site.css", "body{}");

        assertEquals(Optional.of(fixture.physical("/public/css/site.css")), site.findPublicFile("/css/site.css"));
        assertEquals(Optional.of(fixture.physical("/public/css/site.css")), site.findPublicFile("css/site.css"));
    }

    @Test
    void shouldNotServeFilesOutsidePublicDirectory() {
        fixture.writePhysical("/self/identity.md", "private");

        assertTrue(site.findPublicFile("/../self/identity.md").isEmpty());
        assertTrue(site.findPublicFile("/../../etc/passwd").isEmpty());
        assertTrue(site.findPublicFile("/").isEmpty());
        assertTrue(site.findPublicFile("/images").isEmpty());
        assertTrue(site.findPublicFile("/missing.html").isEmpty());
    }

    @Test
    void shouldNotServeLinkPointingOutOfPublicDirectory() throws IOException {
        fixture.writePhysical("/self/identity.md", "private");
        Files.createSymbolicLink(fixture.physical("/public/leak.md"), fixture.physical("/self/identity.md"));

        assertTrue(site.findPublicFile("/leak.md").isEmpty());
    }
}

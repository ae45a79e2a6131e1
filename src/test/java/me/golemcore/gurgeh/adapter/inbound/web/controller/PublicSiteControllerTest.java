package me.golemcore.gurgeh.adapter.inbound.web.controller;

import me.golemcore.gurgeh.domain.service.PublicSiteService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublicSiteControllerTest {

    @TempDir
    Path tempDir;

    private PublicSiteService siteService;
    private PublicSiteController controller;

    @BeforeEach
    void setUp() {
        siteService = mock(PublicSiteService.class);
        controller = new PublicSiteController(siteService);
    }

    @Test
    void shouldServeLandingPageAndCountView() {
        when(siteService.landingPage()).thenReturn("<h1>Garden</h1>");

        StepVerifier.create(controller.index())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(MediaType.TEXT_HTML, response.getHeaders().getContentType());
                    assertEquals("<h1>Garden</h1>", response.getBody());
                })
                .verifyComplete();
        verify(siteService).recordPageView();
    }

    @Test
    void shouldServeDonationPageAndCountView() {
        when(siteService.donationPage()).thenReturn("<h1>Support This Entity</h1>");

        StepVerifier.create(controller.donate())
                .assertNext(response -> assertEquals("<h1>Support This Entity</h1>", response.getBody()))
                .verifyComplete();
        verify(siteService).recordPageView();
    }

    @Test
    void shouldServeStaticFileWithContentType() throws IOException {
        Path css = Files.writeString(tempDir.resolve("site.css"), "body{}");
        when(siteService.findPublicFile("/css/site.css")).thenReturn(Optional.of(css));

        StepVerifier.create(controller.publicFile("/css/site.css"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("text/css", response.getHeaders().getContentType().toString());
                })
                .verifyComplete();
        verify(siteService, never()).recordPageView();
    }

    @Test
    void shouldReturnNotFoundForMissingStaticFile() {
        when(siteService.findPublicFile("/../self/identity.md")).thenReturn(Optional.empty());

        StepVerifier.create(controller.publicFile("/../self/identity.md"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertNull(response.getBody());
                })
                .verifyComplete();
    }
}

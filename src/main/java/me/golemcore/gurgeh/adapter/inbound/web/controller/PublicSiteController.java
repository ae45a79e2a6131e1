package me.golemcore.gurgeh.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gurgeh.domain.service.PublicSiteService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * The agent's public website. Landing and donation page visits count as page
 * views; static files under {@code /public} do not.
 */
@RestController
@RequiredArgsConstructor
public class PublicSiteController {

    private final PublicSiteService siteService;

    @GetMapping("/")
    public Mono<ResponseEntity<String>> index() {
        return Mono.fromCallable(() -> {
            siteService.recordPageView();
            return html(siteService.landingPage());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/donate")
    public Mono<ResponseEntity<String>> donate() {
        return Mono.fromCallable(() -> {
            siteService.recordPageView();
            return html(siteService.donationPage());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/public/{*path}")
    public Mono<ResponseEntity<Resource>> publicFile(@PathVariable String path) {
        return Mono.fromCallable(() -> siteService.findPublicFile(path)
                .<ResponseEntity<Resource>>map(file -> {
                    Resource resource = new FileSystemResource(file);
                    MediaType type = MediaTypeFactory.getMediaType(resource)
                            .orElse(MediaType.APPLICATION_OCTET_STREAM);
                    return ResponseEntity.ok().contentType(type).body(resource);
                })
                .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<String> html(String body) {
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(body);
    }
}

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gurgeh.adapter.outbound.web;

import me.golemcore.gurgeh.domain.model.FetchResult;
import me.golemcore.gurgeh.infrastructure.config.AgentProperties;
import me.golemcore.gurgeh.port.outbound.FetchPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HTTP GET adapter limited to an allow-list of domains.
 *
 * <p>
 * A host is allowed when it equals an allow-listed domain or is a subdomain of
 * one. Redirects are followed by the adapter itself, up to
 * {@value #MAX_REDIRECTS} hops, and every hop is checked against the
 * allow-list. Bodies are read up to the configured cap; longer bodies are cut
 * at a character boundary and marked. Any transport failure or disallowed
 * domain yields an empty result.
 *
 * <p>
 * Configuration via {@code agent.fetch.*}.
 */
@Component
@Slf4j
public class OkHttpFetchAdapter implements FetchPort {

    static final String TRUNCATION_MARKER = "\n[...truncated at 100KB]";
    static final int MAX_REDIRECTS = 5;

    private final OkHttpClient httpClient;
    private final List<String> allowedDomains;
    private final int maxResponseBytes;
    private final String userAgent;

    public OkHttpFetchAdapter(AgentProperties properties, OkHttpClient baseHttpClient) {
        AgentProperties.FetchProperties config = properties.getFetch();
        this.allowedDomains = config.getAllowedDomains().stream()
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .filter(d -> !d.isEmpty())
                .toList();
        this.maxResponseBytes = config.getMaxResponseBytes();
        this.userAgent = config.getUserAgent();

        // Dedicated client: the whole call must finish in time, redirects are checked per hop
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(config.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .followRedirects(false)
                .followSslRedirects(false)
                .build();
    }

    @Override
    public Optional<FetchResult> fetch(String url) {
        if (!isDomainAllowed(url)) {
            log.warn("[Fetch] Domain not allowed: {}", url);
            return Optional.empty();
        }

        HttpUrl current = HttpUrl.parse(url);
        try {
            for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
                Request request = new Request.Builder()
                        .url(current)
                        .header("User-Agent", userAgent)
                        .get()
                        .build();

                try (Response response = httpClient.newCall(request).execute()) {
                    String location = response.header("Location");
                    if (response.isRedirect() && location != null) {
                        HttpUrl next = current.resolve(location);
                        if (next == null || !isDomainAllowed(next.toString())) {
                            log.warn("[Fetch] Redirect from {} to disallowed location: {}", current, location);
                            return Optional.empty();
                        }
                        log.debug("[Fetch] Redirect {} -> {}", current, next);
                        current = next;
                        continue;
                    }

                    ResponseBody body = response.body();
                    String text = body != null ? readCapped(body) : "";
                    log.info("[Fetch] GET {} -> HTTP {} ({} chars)", current, response.code(), text.length());
                    return Optional.of(new FetchResult(response.code(), text));
                }
            }
        } catch (IOException e) {
            log.warn("[Fetch] Request to {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
        log.warn("[Fetch] Too many redirects for {}", url);
        return Optional.empty();
    }

    @Override
    public boolean isDomainAllowed(String url) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            return false;
        }
        String host = parsed.host().toLowerCase(Locale.ROOT);
        for (String domain : allowedDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    private String readCapped(ResponseBody body) throws IOException {
        try (InputStream in = body.byteStream()) {
            byte[] bytes = in.readNBytes(maxResponseBytes + 1);
            if (bytes.length > maxResponseBytes) {
                return decodeTruncated(bytes, maxResponseBytes) + TRUNCATION_MARKER;
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Decodes the first {@code length} bytes, dropping a multi-byte character
     * cut by the cap.
     */
    static String decodeTruncated(byte[] bytes, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, length);
        CharBuffer out = CharBuffer.allocate(length);
        // endOfInput=false leaves an incomplete trailing sequence undecoded
        decoder.decode(in, out, false);
        out.flip();
        return out.toString();
    }
}

package me.golemcore.gurgeh.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marks published markup as AI-generated: a generator meta tag in the head
 * and a visible footer before the closing body tag. Applying it twice yields
 * the same document.
 */
@Component
public class DisclosureInjector {

    static final String GENERATOR_ID = "autonomous-ai-agent";
    static final String DISCLOSURE_TEXT = "This content was created by an autonomous AI entity.";

    private static final String META_TAG = "<meta name=\"generator\" content=\"" + GENERATOR_ID + "\">";
    private static final String FOOTER = "\n<div style=\"margin-top:40px;padding:12px;border-top:1px solid #ccc;"
            + "font-size:0.85em;color:#666;\">\n  " + DISCLOSURE_TEXT + "\n</div>";
    private static final Pattern HEAD_OPEN = Pattern.compile("<head(\\s[^>]*)?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CLOSE = Pattern.compile("</body\\s*>", Pattern.CASE_INSENSITIVE);

    public boolean isMarkup(String path) {
        if (path == null) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".html") || lower.endsWith(".htm");
    }

    public String inject(String html) {
        String result = html != null ? html : "";

        if (!result.contains(GENERATOR_ID)) {
            Matcher head = HEAD_OPEN.matcher(result);
            if (head.find()) {
                result = result.substring(0, head.end()) + "\n  " + META_TAG + result.substring(head.end());
            }
        }

        if (!result.contains(DISCLOSURE_TEXT)) {
            int bodyClose = lastBodyClose(result);
            if (bodyClose >= 0) {
                result = result.substring(0, bodyClose) + FOOTER + "\n" + result.substring(bodyClose);
            } else {
                result = result + FOOTER;
            }
        }
        return result;
    }

    // Matched on the original text: lower-casing can change string length
    private static int lastBodyClose(String html) {
        Matcher matcher = BODY_CLOSE.matcher(html);
        int last = -1;
        while (matcher.find()) {
            last = matcher.start();
        }
        return last;
    }
}

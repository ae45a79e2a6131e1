package me.golemcore.gurgeh.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The agent's self-description files. Missing files are null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentityResponse {
    private String identity;
    private String values;
    private String currentFocus;
}

package com.streamhub.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for relaying a signaling message to another peer of the room.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    /** Wire name: "offer", "answer" or "ice-candidate". */
    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "to is required")
    private String to;

    /** Session description, for offer and answer. */
    private String sdp;

    /** Candidate fields, for ice-candidate. */
    private Map<String, String> candidate;
}

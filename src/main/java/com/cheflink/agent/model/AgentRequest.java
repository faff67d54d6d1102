package com.cheflink.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "input must not be blank")
    private String input;

    /**
     * Optional. Used as the conversation id of the run; a fresh id is
     * generated when absent.
     */
    private String sessionId;

    /**
     * Optional. Scopes meal plans and preferences; defaults to "default".
     */
    private String userId;
}

package com.deepansh.billbot.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    @Size(max = 4000)
    private String message;

    // generated when absent
    private String sessionId;
    private String connectionId;

    @Valid
    private SearchOptions options;
}

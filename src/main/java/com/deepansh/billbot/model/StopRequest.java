package com.deepansh.billbot.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StopRequest {

    @NotBlank
    private String sessionId;

    @NotBlank
    private String connectionId;

    /** Also close the connection's event stream */
    private boolean closeConnection;
}

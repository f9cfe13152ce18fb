package com.voxell.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ErrorResponse - Body of every non-2xx response.
 *
 * <pre>
 * { "detail": "Invalid login credentials", "code": "INVALID_CREDENTIALS" }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String detail;

    private String code;
}

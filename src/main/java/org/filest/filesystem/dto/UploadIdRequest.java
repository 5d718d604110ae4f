package org.filest.filesystem.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * complete / abort 请求体。
 */
public record UploadIdRequest(
        @NotBlank String uploadId
) {
}

package com.tinyurl.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

// customCode is optional; when absent a code is generated
public record CreateUrlRequest(
        @NotBlank(message = "url cannot be blank")
        String url,

        @Pattern(regexp = "^[A-Za-z0-9-]{1,20}$",
                message = "customCode must be 1-20 characters of letters, digits or hyphens")
        String customCode) {

    public CreateUrlRequest(String url) {
        this(url, null);
    }
}

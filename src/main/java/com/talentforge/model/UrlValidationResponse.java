package com.talentforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UrlValidationResponse {

    private String plainToken;
    private String encryptedToken;
}

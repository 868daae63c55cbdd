package com.talentforge.security;

import com.talentforge.exception.CallbackAccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Shared-secret gate for transcript callbacks. The secret travels to the
 * transcription service with each job and must come back in
 * {@value #SECRET_HEADER}. With no secret configured callbacks are refused.
 */
@Component
public class TranscriptCallbackAuthInterceptor implements HandlerInterceptor {

    public static final String SECRET_HEADER = "X-Callback-Secret";

    private final String callbackSecret;

    public TranscriptCallbackAuthInterceptor(@Value("${pipeline.callback-secret:}") String callbackSecret) {
        this.callbackSecret = callbackSecret;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (callbackSecret == null || callbackSecret.isBlank()) {
            throw new CallbackAccessDeniedException("Callback secret not configured");
        }

        String presented = request.getHeader(SECRET_HEADER);
        if (presented == null || presented.isBlank()) {
            throw new CallbackAccessDeniedException("Missing callback secret");
        }

        if (!HmacSigner.constantTimeEquals(callbackSecret, presented.trim())) {
            throw new CallbackAccessDeniedException("Invalid callback secret");
        }
        return true;
    }
}

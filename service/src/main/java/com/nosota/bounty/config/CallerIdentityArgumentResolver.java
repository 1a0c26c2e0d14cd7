package com.nosota.bounty.config;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.IdentityHeaders;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Arrays;
import java.util.UUID;

/**
 * Builds the {@link CallerIdentity} controller argument from the headers set by the authenticating gateway.
 *
 * <p>Headers:
 * <ul>
 *   <li>{@code X-User-Id} - required UUID, otherwise UNAUTHENTICATED</li>
 *   <li>{@code X-Email-Verified} - {@code true}/{@code false}, absent means false</li>
 *   <li>{@code X-User-Roles} - comma separated, {@code ADMIN} grants dispute resolution</li>
 * </ul>
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        String userIdHeader = webRequest.getHeader(IdentityHeaders.USER_ID);
        if (userIdHeader == null || userIdHeader.isBlank()) {
            throw new BountyLifecycleException(LifecycleErrorKind.UNAUTHENTICATED,
                    "Missing " + IdentityHeaders.USER_ID + " header");
        }

        UUID userId;
        try {
            userId = UUID.fromString(userIdHeader.trim());
        } catch (IllegalArgumentException e) {
            throw new BountyLifecycleException(LifecycleErrorKind.UNAUTHENTICATED,
                    "Malformed " + IdentityHeaders.USER_ID + " header: " + userIdHeader, e);
        }

        boolean emailVerified = Boolean.parseBoolean(webRequest.getHeader(IdentityHeaders.EMAIL_VERIFIED));

        String roles = webRequest.getHeader(IdentityHeaders.USER_ROLES);
        boolean admin = roles != null && Arrays.stream(roles.split(","))
                .map(String::trim)
                .anyMatch(IdentityHeaders.ADMIN_ROLE::equalsIgnoreCase);

        return new CallerIdentity(userId, emailVerified, admin);
    }
}

package net.revivatech.domain.page;

import java.util.List;

/**
 * Access rule for a page.
 *
 * @param required whether a signed-in user is needed
 * @param roles roles allowed to view the page; empty means any signed-in user
 * @param redirectTo where anonymous visitors are sent
 */
public record AuthSpec(boolean required, List<String> roles, String redirectTo) {

    public static final String DEFAULT_REDIRECT = "/login";

    public static final AuthSpec PUBLIC = new AuthSpec(false, List.of(), DEFAULT_REDIRECT);

    public AuthSpec {
        roles = roles == null ? List.of() : List.copyOf(roles);
        redirectTo = redirectTo == null || redirectTo.isBlank() ? DEFAULT_REDIRECT : redirectTo;
    }

    public boolean allowsRole(String role) {
        return roles.isEmpty() || (role != null && roles.contains(role));
    }
}

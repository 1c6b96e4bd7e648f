package io.intellixity.tabula.server.web;

import io.intellixity.tabula.governance.Governance;
import io.intellixity.tabula.governance.GovernanceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Binds the acting user from {@value #USER_HEADER} for the duration of an API request. */
@Component
public final class OwnerContextFilter extends OncePerRequestFilter {
  public static final String USER_HEADER = "X-User-Id";

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String userId = request.getHeader(USER_HEADER);
    if (userId == null || userId.isBlank()) {
      response.sendError(400, "Missing required header: " + USER_HEADER);
      return;
    }
    GovernanceContext ctx = GovernanceContext.forUser(userId.trim());

    try {
      Governance.inContext(ctx, () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (Exception e) {
          throw new RuntimeException(e);
        }
        return null;
      });
    } catch (RuntimeException e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      if (c instanceof ServletException se) throw se;
      throw e;
    }
  }
}

package com.ospicorp.livewhen.config;

import static com.ospicorp.livewhen.web.RequestDescriptions.clientIp;
import static com.ospicorp.livewhen.web.RequestDescriptions.uriWithQuery;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(), uriWithQuery(request), clientIp(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      if (request.getRequestURI().startsWith("/actuator")) {
        log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
            response.getStatus(), durationMs);
      } else {
        log.info("HTTP {} {} from {} -> {} ({} ms)",
            request.getMethod(),
            uriWithQuery(request),
            clientIp(request),
            response.getStatus(),
            durationMs);
      }
    }
  }
}

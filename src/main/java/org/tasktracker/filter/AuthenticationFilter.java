package org.tasktracker.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.tasktracker.auth.Authenticator;
import org.tasktracker.auth.CredentialTransport;
import org.tasktracker.auth.Identity;
import org.tasktracker.exception.CustomException;
import org.tasktracker.utils.LogUtils;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

// 从请求中取出身份凭证（Cookie 或 Bearer 头，取决于认证策略），解析出身份后放入 Spring Security 上下文。
// 解析失败时不放行到受保护接口，由 RestAuthenticationEntryPoint 返回 401。
@Component
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    /** 认证失败原因，供 entry point 生成响应 */
    public static final String AUTH_ERROR_ATTRIBUTE = AuthenticationFilter.class.getName() + ".AUTH_ERROR";

    @Autowired
    private Authenticator authenticator;

    @Autowired
    private CredentialTransport credentialTransport;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        LogUtils.setRequestContext(UUID.randomUUID().toString().replace("-", ""), null);
        try {
            // 1. 【提取】
            String credential = credentialTransport.extract(request);
            if (credential != null) {
                try {
                    // 2. 【校验】
                    Identity identity = authenticator.resolve(credential);

                    // 3. 【存入上下文】
                    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                            identity, null, List.of(new SimpleGrantedAuthority("ROLE_" + identity.role().name())));
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    request.setAttribute("userId", identity.id());
                    MDC.put(LogUtils.USER_ID, String.valueOf(identity.id()));
                } catch (CustomException e) {
                    request.setAttribute(AUTH_ERROR_ATTRIBUTE, e);
                    log.debug("Credential rejected on {} {}: {}", request.getMethod(), request.getRequestURI(), e.getErrorCode());
                }
            }
            filterChain.doFilter(request, response);
        } finally {
            LogUtils.clearRequestContext();
        }
    }
}

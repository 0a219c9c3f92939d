package org.tasktracker.auth;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.tasktracker.config.TrackerProperties;

/**
 * 按当前认证策略的通道，从请求中取出凭证，或把凭证写回响应。
 */
public class CredentialTransport {

    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialChannel channel;
    private final String cookieName;
    private final boolean cookieSecure;

    public CredentialTransport(CredentialChannel channel, TrackerProperties.Session session) {
        this.channel = channel;
        this.cookieName = session.getCookieName();
        this.cookieSecure = session.isCookieSecure();
    }

    /**
     * @return 客户端出示的凭证；没有携带时返回 null
     */
    public String extract(HttpServletRequest request) {
        if (channel == CredentialChannel.BEARER) {
            String header = request.getHeader("Authorization");
            if (header != null && header.startsWith(BEARER_PREFIX)) {
                return header.substring(BEARER_PREFIX.length()).trim(); // 去掉 "Bearer " 前缀
            }
            return null;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    /**
     * 会话通道下把引用写入 Cookie；令牌通道由响应体返回，这里不做处理。
     */
    public void attach(HttpServletResponse response, String credential, long maxAgeSeconds) {
        if (channel == CredentialChannel.COOKIE) {
            response.addCookie(buildCookie(credential, (int) maxAgeSeconds));
        }
    }

    public void clear(HttpServletResponse response) {
        if (channel == CredentialChannel.COOKIE) {
            response.addCookie(buildCookie("", 0));
        }
    }

    public CredentialChannel channel() {
        return channel;
    }

    private Cookie buildCookie(String value, int maxAge) {
        Cookie cookie = new Cookie(cookieName, value);
        cookie.setHttpOnly(true);
        cookie.setSecure(cookieSecure);
        cookie.setPath("/");
        cookie.setMaxAge(maxAge);
        cookie.setAttribute("SameSite", "Lax");
        return cookie;
    }
}

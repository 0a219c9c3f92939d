package org.tasktracker.auth;

/**
 * 身份凭证在传输层的携带方式。
 */
public enum CredentialChannel {
    /** 服务端会话引用，通过 Cookie 自动回传 */
    COOKIE,
    /** 自包含签名令牌，通过 Authorization: Bearer 头回传 */
    BEARER
}

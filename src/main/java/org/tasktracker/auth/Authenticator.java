package org.tasktracker.auth;

import java.time.Duration;

/**
 * 身份断言的签发与解析。会话和令牌两种实现对调用方完全等价，
 * 由配置项 tracker.auth.strategy 决定启用哪一个。
 */
public interface Authenticator {

    /**
     * 为已验证的身份签发凭证。
     *
     * @param identity 已通过密码校验的身份
     * @return 交给客户端的凭证字符串
     */
    String issue(Identity identity);

    /**
     * 把客户端出示的凭证还原为身份。
     *
     * @param presented 客户端出示的凭证，可能为 null
     * @return 身份
     * @throws org.tasktracker.exception.CustomException 凭证缺失、格式错误、过期或签名不符
     */
    Identity resolve(String presented);

    /**
     * 使凭证失效（登出）。无状态实现可以什么都不做。
     */
    void invalidate(String presented);

    CredentialChannel channel();

    /**
     * 新签发凭证的有效期。
     */
    Duration lifetime();
}

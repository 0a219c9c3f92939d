package org.tasktracker.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

class LogUtilsTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void requestContextCarriesRequestAndUser() {
        LogUtils.setRequestContext("req-1", "42");

        assertThat(MDC.get(LogUtils.REQUEST_ID)).isEqualTo("req-1");
        assertThat(MDC.get(LogUtils.USER_ID)).isEqualTo("42");
        assertThat(MDC.getCopyOfContextMap()).containsOnlyKeys(LogUtils.REQUEST_ID, LogUtils.USER_ID);
    }

    @Test
    void anonymousRequestHasNoUserKey() {
        LogUtils.setRequestContext("req-2", null);

        assertThat(MDC.getCopyOfContextMap()).containsOnlyKeys(LogUtils.REQUEST_ID);
    }

    @Test
    void businessLoggingKeepsRequestContext() {
        LogUtils.setRequestContext("req-3", "7");

        LogUtils.logBusiness("PROJECT", "7", "created %s", "Launch");
        LogUtils.logUserOperation("7", "PROJECT", "CREATE", "SUCCESS");

        assertThat(MDC.get(LogUtils.REQUEST_ID)).isEqualTo("req-3");
        assertThat(MDC.get(LogUtils.OPERATION)).isNull();

        LogUtils.clearRequestContext();
        assertThat(MDC.get(LogUtils.REQUEST_ID)).isNull();
    }
}

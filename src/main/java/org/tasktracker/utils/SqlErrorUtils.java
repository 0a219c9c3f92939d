package org.tasktracker.utils;

import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

/**
 * 按 SQLState 和厂商错误码区分完整性约束的类别，支持 MySQL 和 H2。
 */
public class SqlErrorUtils {

    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final String FK_VIOLATION_STATE = "23503";
    private static final String H2_FK_PARENT_MISSING_STATE = "23506";

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final int MYSQL_FK_CHILD_EXISTS = 1451;
    private static final int MYSQL_FK_PARENT_MISSING = 1452;

    private SqlErrorUtils() {
    }

    public static boolean isUniqueViolation(DataIntegrityViolationException e) {
        SQLException sql = findSqlException(e);
        if (sql == null) {
            return false;
        }
        return UNIQUE_VIOLATION_STATE.equals(sql.getSQLState()) || sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY;
    }

    public static boolean isForeignKeyViolation(DataIntegrityViolationException e) {
        SQLException sql = findSqlException(e);
        if (sql == null) {
            return false;
        }
        String state = sql.getSQLState();
        int code = sql.getErrorCode();
        return FK_VIOLATION_STATE.equals(state) || H2_FK_PARENT_MISSING_STATE.equals(state)
                || code == MYSQL_FK_CHILD_EXISTS || code == MYSQL_FK_PARENT_MISSING;
    }

    private static SQLException findSqlException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }
}

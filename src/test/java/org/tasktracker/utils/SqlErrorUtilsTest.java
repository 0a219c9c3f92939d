package org.tasktracker.utils;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class SqlErrorUtilsTest {

    @Test
    void uniqueViolationOnH2AndMysql() {
        assertThat(SqlErrorUtils.isUniqueViolation(wrap(new SQLException("dup", "23505", 23505)))).isTrue();
        assertThat(SqlErrorUtils.isUniqueViolation(wrap(new SQLException("Duplicate entry", "23000", 1062)))).isTrue();
        assertThat(SqlErrorUtils.isForeignKeyViolation(wrap(new SQLException("dup", "23505", 23505)))).isFalse();
    }

    @Test
    void foreignKeyViolationOnH2AndMysql() {
        assertThat(SqlErrorUtils.isForeignKeyViolation(wrap(new SQLException("parent missing", "23506", 23506)))).isTrue();
        assertThat(SqlErrorUtils.isForeignKeyViolation(wrap(new SQLException("child exists", "23503", 23503)))).isTrue();
        assertThat(SqlErrorUtils.isForeignKeyViolation(wrap(new SQLException("Cannot add", "23000", 1452)))).isTrue();
        assertThat(SqlErrorUtils.isForeignKeyViolation(wrap(new SQLException("Cannot delete", "23000", 1451)))).isTrue();
        assertThat(SqlErrorUtils.isUniqueViolation(wrap(new SQLException("Cannot add", "23000", 1452)))).isFalse();
    }

    @Test
    void valueTooLongIsNeither() {
        DataIntegrityViolationException tooLong = wrap(new SQLException("Value too long for column", "22001", 22001));

        assertThat(SqlErrorUtils.isUniqueViolation(tooLong)).isFalse();
        assertThat(SqlErrorUtils.isForeignKeyViolation(tooLong)).isFalse();
    }

    @Test
    void noSqlCauseIsNeither() {
        DataIntegrityViolationException bare = new DataIntegrityViolationException("no cause");

        assertThat(SqlErrorUtils.isUniqueViolation(bare)).isFalse();
        assertThat(SqlErrorUtils.isForeignKeyViolation(bare)).isFalse();
    }

    // Hibernate 把 SQLException 包在 JDBCException 里，再由 Spring 转换
    private static DataIntegrityViolationException wrap(SQLException sql) {
        return new DataIntegrityViolationException("could not execute statement",
                new RuntimeException("constraint violation", sql));
    }
}

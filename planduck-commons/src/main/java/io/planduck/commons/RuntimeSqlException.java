package io.planduck.commons;

import java.sql.SQLException;

public class RuntimeSqlException extends RuntimeException {
    final SQLException sqlException;
    public RuntimeSqlException(SQLException sqlException){
        super(sqlException.getMessage(), sqlException);
        this.sqlException = sqlException;
    }

    public SQLException getSqlException() {
        return sqlException;
    }
}

package com.qcollector.backend.executor;

import com.qcollector.backend.exception.SchemaExecutorException;

/**
 * Performs the actual DDL against a form table. Provided by the host application; the engine
 * only decides when each call happens and records what came back.
 *
 * <p>Every method either returns a result or throws {@link SchemaExecutorException}; the
 * exception's reason tells the queue whether another attempt can help.
 */
public interface SchemaExecutor {

    SchemaChangeResult addColumn(String tableName, String fieldId, String columnName, String dataType,
                                 SchemaContext context);

    SchemaChangeResult dropColumn(String tableName, String fieldId, String columnName, SchemaContext context);

    SchemaChangeResult renameColumn(String tableName, String fieldId, String oldColumnName, String newColumnName,
                                    SchemaContext context);

    SchemaChangeResult changeColumnType(String tableName, String fieldId, String columnName, String oldType,
                                        String newType, SchemaContext context);
}

/**
 * Contract Test suites shared by every store adapter and codec.
 *
 * <p>Adapters extend {@link com.ryuqq.execdb.testkit.contract.AbstractRecordStoreContractTest}
 * for the storage primitives and
 * {@link com.ryuqq.execdb.testkit.contract.AbstractExecutionDatabaseContractTest}
 * for the whole database cycle.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
package com.ryuqq.execdb.testkit.contract;

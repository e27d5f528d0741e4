package com.ryuqq.execdb.adapter.inmemory.store;

import com.ryuqq.execdb.adapter.jackson.JacksonCommandCodec;
import com.ryuqq.execdb.adapter.jackson.JacksonEventCodec;
import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.spi.RecordStore;
import com.ryuqq.execdb.testkit.contract.AbstractExecutionDatabaseContractTest;

/**
 * Contract Tests for the execution database over InMemoryRecordStore and the Jackson codecs.
 *
 * @author Execution Team
 * @since 1.0.0
 */
class InMemoryExecutionDatabaseContractTest extends AbstractExecutionDatabaseContractTest {

    @Override
    protected RecordStore createStore() {
        return new InMemoryRecordStore();
    }

    @Override
    protected CommandCodec createCommandCodec() {
        return new JacksonCommandCodec();
    }

    @Override
    protected EventCodec createEventCodec() {
        return new JacksonEventCodec();
    }
}

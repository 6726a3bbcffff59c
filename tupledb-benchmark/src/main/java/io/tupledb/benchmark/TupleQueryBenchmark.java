package io.tupledb.benchmark;

import io.tupledb.common.ObjectAndRelation;
import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;
import io.tupledb.datastore.DatastoreConfig;
import io.tupledb.datastore.ExecutionMode;
import io.tupledb.datastore.TupleDatastore;
import io.tupledb.datastore.TupleIterator;
import io.tupledb.datastore.TupleQuery;
import io.tupledb.storage.InMemoryTupleStorage;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class TupleQueryBenchmark {

    private static final int DOCUMENT_COUNT = 10_000;
    private static final int VIEWERS_PER_DOCUMENT = 5;

    @Param({"MATERIALIZED", "STREAMING"})
    private ExecutionMode mode;

    private TupleDatastore datastore;
    private Revision head;

    @Setup(Level.Trial)
    public void setup() {
        InMemoryTupleStorage storage = new InMemoryTupleStorage();
        Revision revision = Revision.ZERO;

        for (int doc = 0; doc < DOCUMENT_COUNT; doc++) {
            for (int viewer = 0; viewer < VIEWERS_PER_DOCUMENT; viewer++) {
                revision = revision.next();
                RelationTuple tuple = RelationTuple.of(
                    ObjectAndRelation.of("doc", Integer.toString(doc), "viewer"),
                    ObjectAndRelation.object("user", "user-" + viewer)
                );
                storage.insert(tuple, revision);
                if (viewer == 0 && doc % 2 == 0) {
                    revision = revision.next();
                    storage.delete(tuple, revision);
                }
            }
        }

        head = revision;
        datastore = TupleDatastore.open(storage, DatastoreConfig.defaults().withExecutionMode(mode));
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        datastore.close();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long scanNamespace() {
        long count = 0;
        try (TupleIterator iterator = datastore.execute(datastore.queryTuples("doc", head))) {
            while (iterator.next().isPresent()) {
                count++;
            }
        }
        return count;
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public void checkSingleObject(Blackhole bh) {
        String objectId = Integer.toString(ThreadLocalRandom.current().nextInt(DOCUMENT_COUNT));
        TupleQuery query = datastore.queryTuples("doc", head)
            .withObjectId(objectId)
            .withRelation("viewer");
        try (TupleIterator iterator = datastore.execute(query)) {
            for (Optional<RelationTuple> tuple = iterator.next(); tuple.isPresent(); tuple = iterator.next()) {
                bh.consume(tuple.get());
            }
        }
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public void firstTupleOnly(Blackhole bh) {
        try (TupleIterator iterator = datastore.execute(datastore.queryTuples("doc", head))) {
            bh.consume(iterator.next());
        }
    }
}

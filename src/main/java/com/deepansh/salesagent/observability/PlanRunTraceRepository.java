package com.deepansh.salesagent.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface PlanRunTraceRepository extends MongoRepository<PlanRunTrace, String> {

    List<PlanRunTrace> findByUserIdOrderByCreatedAtDesc(String userId);

    List<PlanRunTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    @Query(value = "{ 'userId': ?0, 'createdAt': { $gte: ?1 } }", count = true)
    long countRecentByUser(String userId, Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatencyForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<StatusCount> statusBreakdownForUser(String userId);

    record StatusCount(String id, long count) {}
}

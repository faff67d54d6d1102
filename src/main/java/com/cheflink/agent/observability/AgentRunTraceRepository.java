package com.cheflink.agent.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AgentRunTraceRepository extends MongoRepository<AgentRunTrace, String> {

    List<AgentRunTrace> findByUserIdOrderByCreatedAtDesc(String userId);

    List<AgentRunTrace> findByConversationIdOrderByCreatedAtDesc(String conversationId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: null, avg: { $avg: '$totalDurationMs' } } }"
    })
    Double avgDurationForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0, 'createdAt': { $gte: ?1 } } }",
        "{ $group: { _id: null, total: { $sum: '$totalCost' } } }"
    })
    Double totalCostSince(String userId, Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$terminationReason', count: { $sum: 1 } } }"
    })
    List<ReasonCount> terminationBreakdownForUser(String userId);

    record ReasonCount(String id, long count) {}
}

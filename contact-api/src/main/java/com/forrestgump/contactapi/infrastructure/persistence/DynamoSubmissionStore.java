package com.forrestgump.contactapi.infrastructure.persistence;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.model.SubmissionCandidate;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.infrastructure.config.AwsConfig;
import com.forrestgump.contactapi.infrastructure.config.ContactProperties;
import com.forrestgump.contactapi.infrastructure.exception.StoreUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbAsyncTable;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedAsyncClient;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * DynamoDB-backed {@link SubmissionStore}.
 *
 * <p>The insert is a two-item transaction: the submission itself and a claim keyed by its content hash.
 * The claim's condition fails when another submission with the same content got there first, which
 * closes the race left open by the advisory duplicate read. A {@code TransactionConflict} on the claim
 * means a concurrent transaction is writing the same content hash, so it is reported as a duplicate too.
 *
 * <p>A write that times out may still commit on the DynamoDB side. The caller then sees
 * {@link StoreUnavailableException} for a submission that exists and was never notified.
 */
@Component
public class DynamoSubmissionStore implements SubmissionStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoSubmissionStore.class);
    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    private static final String TRANSACTION_CONFLICT = "TransactionConflict";
    // Cancellation reasons follow the order of the transaction's items.
    private static final int CLAIM_ITEM_INDEX = 1;

    private final DynamoDbEnhancedAsyncClient enhancedClient;
    private final DynamoDbAsyncTable<SubmissionEntity> submissionTable;
    private final DynamoDbAsyncTable<ContentHashClaim> claimTable;
    private final CircuitBreaker dynamoCircuitBreaker;
    private final Duration timeout;

    public DynamoSubmissionStore(DynamoDbEnhancedAsyncClient enhancedClient, AwsConfig awsConfig,
                                 ContactProperties contactProperties,
                                 @Qualifier("dynamoCircuitBreaker") CircuitBreaker dynamoCircuitBreaker) {
        this.enhancedClient = enhancedClient;
        this.submissionTable = enhancedClient.table(awsConfig.dynamodb().tableName(),
                TableSchema.fromBean(SubmissionEntity.class));
        this.claimTable = enhancedClient.table(awsConfig.dynamodb().claimsTableName(),
                TableSchema.fromBean(ContentHashClaim.class));
        this.dynamoCircuitBreaker = dynamoCircuitBreaker;
        this.timeout = contactProperties.store().timeout();
    }

    @Override
    public Mono<Boolean> existsByContentHash(String contentHash, Instant since) {
        return queryIndex(SubmissionEntity.CONTENT_HASH_INDEX, contentHash, since, 1)
                .hasElements();
    }

    @Override
    public Flux<Submission> findBySourceIdentity(String sourceIdentity, Instant since, int limit) {
        return queryIndex(SubmissionEntity.SOURCE_IP_INDEX, sourceIdentity, since, limit);
    }

    @Override
    public Flux<Submission> findByEmail(String email, Instant since, int limit) {
        return queryIndex(SubmissionEntity.EMAIL_INDEX, email, since, limit);
    }

    @Override
    public Mono<Submission> insertIfAbsent(SubmissionCandidate candidate, Instant duplicateSince) {
        return Mono.defer(() -> {
                    Submission submission = candidate.withId(UUID.randomUUID().toString());
                    TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
                            .addPutItem(submissionTable, TransactPutItemEnhancedRequest.builder(SubmissionEntity.class)
                                    .item(SubmissionEntity.from(submission))
                                    .conditionExpression(Expression.builder()
                                            .expression("attribute_not_exists(messageId)")
                                            .build())
                                    .build())
                            .addPutItem(claimTable, TransactPutItemEnhancedRequest.builder(ContentHashClaim.class)
                                    .item(ContentHashClaim.from(submission))
                                    .conditionExpression(claimCondition(duplicateSince))
                                    .build())
                            .build();
                    return Mono.fromFuture(enhancedClient.transactWriteItems(request))
                            .thenReturn(submission);
                })
                .timeout(timeout)
                .onErrorMap(DynamoSubmissionStore::isContentConflict,
                        e -> new DuplicateSubmissionException(candidate.contentHash()))
                .doOnError(e -> !(e instanceof DuplicateSubmissionException),
                        e -> logger.error("Failed to save submission to DynamoDB, contentHash: {}, error: {}",
                                candidate.contentHash(), unwrap(e).toString()))
                .transformDeferred(CircuitBreakerOperator.of(dynamoCircuitBreaker))
                .onErrorMap(e -> !(e instanceof DuplicateSubmissionException),
                        e -> new StoreUnavailableException("Failed to save to DynamoDB", unwrap(e)))
                .doOnSuccess(saved -> logger.info("Submission saved successfully to DynamoDB, id: {}", saved.id()));
    }

    private Flux<Submission> queryIndex(String indexName, String partitionValue, Instant since, int limit) {
        QueryConditional condition = since == null
                ? QueryConditional.keyEqualTo(Key.builder().partitionValue(partitionValue).build())
                : QueryConditional.sortGreaterThanOrEqualTo(Key.builder()
                        .partitionValue(partitionValue)
                        .sortValue(since.toEpochMilli())
                        .build());
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                .queryConditional(condition)
                .scanIndexForward(true)
                .limit(limit)
                .build();

        return Flux.defer(() -> Flux.from(submissionTable.index(indexName).query(request)))
                .flatMapIterable(Page::items)
                .take(limit)
                .map(SubmissionEntity::toSubmission)
                .timeout(timeout)
                .doOnError(e -> logger.error("Failed to query DynamoDB index {}, error: {}", indexName,
                        unwrap(e).toString()))
                .transformDeferred(CircuitBreakerOperator.of(dynamoCircuitBreaker))
                .onErrorMap(e -> new StoreUnavailableException("Failed to query DynamoDB index " + indexName, unwrap(e)));
    }

    private static Expression claimCondition(Instant duplicateSince) {
        if (duplicateSince == null) {
            return Expression.builder()
                    .expression("attribute_not_exists(contentHash)")
                    .build();
        }
        return Expression.builder()
                .expression("attribute_not_exists(contentHash) OR createdAtEpochMillis < :duplicateSince")
                .putExpressionValue(":duplicateSince", AttributeValue.builder()
                        .n(Long.toString(duplicateSince.toEpochMilli()))
                        .build())
                .build();
    }

    static boolean isContentConflict(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ConditionalCheckFailedException) {
            return true;
        }
        if (!(cause instanceof TransactionCanceledException)) {
            return false;
        }
        TransactionCanceledException cancelled = (TransactionCanceledException) cause;
        if (!cancelled.hasCancellationReasons()) {
            return false;
        }
        List<CancellationReason> reasons = cancelled.cancellationReasons();
        if (reasons.stream().anyMatch(reason -> CONDITIONAL_CHECK_FAILED.equals(reason.code()))) {
            return true;
        }
        return reasons.size() > CLAIM_ITEM_INDEX
                && TRANSACTION_CONFLICT.equals(reasons.get(CLAIM_ITEM_INDEX).code());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

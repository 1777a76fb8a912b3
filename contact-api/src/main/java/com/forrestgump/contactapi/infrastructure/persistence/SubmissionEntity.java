package com.forrestgump.contactapi.infrastructure.persistence;

import com.forrestgump.contactapi.domain.model.Submission;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

import java.time.Instant;

/**
 * Submissions table item. Every secondary index sorts by {@code createdAtEpochMillis} so window queries
 * are key conditions rather than filters.
 */
@DynamoDbBean
public class SubmissionEntity {

    public static final String CONTENT_HASH_INDEX = "ContentHashIndex";
    public static final String SOURCE_IP_INDEX = "SourceIpIndex";
    public static final String EMAIL_INDEX = "EmailIndex";

    private String messageId;
    private String name;
    private String email;
    private String message;
    private String contentHash;
    private String sourceIp;
    private Instant createdAt;
    private Long createdAtEpochMillis;

    // Default constructor required by DynamoDb Enhanced Client
    public SubmissionEntity() {
    }

    public static SubmissionEntity from(Submission submission) {
        SubmissionEntity entity = new SubmissionEntity();
        entity.setMessageId(submission.id());
        entity.setName(submission.name());
        entity.setEmail(submission.email());
        entity.setMessage(submission.body());
        entity.setContentHash(submission.contentHash());
        entity.setSourceIp(submission.sourceIdentity());
        entity.setCreatedAt(submission.createdAt());
        entity.setCreatedAtEpochMillis(submission.createdAt().toEpochMilli());
        return entity;
    }

    public Submission toSubmission() {
        return new Submission(messageId, name, email, message, contentHash, sourceIp, createdAt);
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("messageId")
    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    @DynamoDbAttribute("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = EMAIL_INDEX)
    @DynamoDbAttribute("email")
    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    @DynamoDbAttribute("message")
    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = CONTENT_HASH_INDEX)
    @DynamoDbAttribute("contentHash")
    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = SOURCE_IP_INDEX)
    @DynamoDbAttribute("sourceIp")
    public String getSourceIp() {
        return sourceIp;
    }

    public void setSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
    }

    @DynamoDbAttribute("createdAt")
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbSecondarySortKey(indexNames = {CONTENT_HASH_INDEX, SOURCE_IP_INDEX, EMAIL_INDEX})
    @DynamoDbAttribute("createdAtEpochMillis")
    public Long getCreatedAtEpochMillis() {
        return createdAtEpochMillis;
    }

    public void setCreatedAtEpochMillis(Long createdAtEpochMillis) {
        this.createdAtEpochMillis = createdAtEpochMillis;
    }
}

package com.forrestgump.contactapi.infrastructure.persistence;

import com.forrestgump.contactapi.domain.model.Submission;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * One item per content hash, written in the same transaction as the submission. Its key condition is
 * what makes the insert conditional on content.
 */
@DynamoDbBean
public class ContentHashClaim {

    private String contentHash;
    private String messageId;
    private Long createdAtEpochMillis;

    public ContentHashClaim() {
    }

    public static ContentHashClaim from(Submission submission) {
        ContentHashClaim claim = new ContentHashClaim();
        claim.setContentHash(submission.contentHash());
        claim.setMessageId(submission.id());
        claim.setCreatedAtEpochMillis(submission.createdAt().toEpochMilli());
        return claim;
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("contentHash")
    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    @DynamoDbAttribute("messageId")
    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    @DynamoDbAttribute("createdAtEpochMillis")
    public Long getCreatedAtEpochMillis() {
        return createdAtEpochMillis;
    }

    public void setCreatedAtEpochMillis(Long createdAtEpochMillis) {
        this.createdAtEpochMillis = createdAtEpochMillis;
    }
}

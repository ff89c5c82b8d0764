package com.trademind.memory.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Metadata table row keyed by the same id as its {@link MemoryVectorRow}.
 * {@code createdAt} is epoch milliseconds; {@code outcomeLabel} and {@code symbol} are
 * nullable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("memory_metadata")
public class MemoryMetadataRow {

    @Id
    private String recordId;

    private String agentId;

    private String eventKind;

    private String summary;

    private double importance;

    private long createdAt;

    private String outcomeLabel;

    private String symbol;
}

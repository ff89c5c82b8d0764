package com.trademind.memory.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Durable vector index entry. The vector is stored as a JSON float array so the same
 * schema works on H2 and PostgreSQL.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("memory_vector")
public class MemoryVectorRow {

    @Id
    private String recordId;

    private int dimension;

    private String vectorJson;
}

package com.flamingo.ai.memoryvault.domain.entity;

import com.flamingo.ai.memoryvault.domain.converter.MetadataConverter;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A stored memory entry.
 *
 * <p>Records are never deleted by consolidation. A merged record is tombstoned by pointing {@link
 * #consolidatedInto} at its successor, which is always created after it.
 */
@Entity
@Table(
    name = "memories",
    indexes = {
      @Index(name = "idx_memories_category", columnList = "category"),
      @Index(name = "idx_memories_namespace", columnList = "namespace"),
      @Index(name = "idx_memories_consolidated", columnList = "consolidated_into")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryRecord {

  public static final String DEFAULT_NAMESPACE = "default";
  public static final float DEFAULT_IMPORTANCE = 0.7f;

  /** Assigned by the caller: a random UUID for new records, preserved on import. */
  @Id
  @Column(length = 64)
  private String id;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String text;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  @Builder.Default
  private MemoryCategory category = MemoryCategory.OTHER;

  /** Importance score from 0.0 to 1.0. */
  @Column(nullable = false)
  @Builder.Default
  private float importance = DEFAULT_IMPORTANCE;

  @Column(nullable = false)
  @Builder.Default
  private int accessCount = 0;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  private Instant lastAccessedAt;

  /** Id of the record this one was merged into, or null while the record is active. */
  @Column(name = "consolidated_into", length = 64)
  private String consolidatedInto;

  @Column(nullable = false)
  @Builder.Default
  private String namespace = DEFAULT_NAMESPACE;

  private String agentId;

  @Convert(converter = MetadataConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Object> metadata;

  /** Whether the record has not been merged into a successor. */
  public boolean isActive() {
    return consolidatedInto == null;
  }
}

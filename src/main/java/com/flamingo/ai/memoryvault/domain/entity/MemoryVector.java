package com.flamingo.ai.memoryvault.domain.entity;

import com.flamingo.ai.memoryvault.domain.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapsId;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** The embedding paired with a {@link MemoryRecord}, keyed by the same id. */
@Entity
@Table(name = "memory_vectors")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryVector {

  @Id
  @Column(length = 64)
  private String id;

  @MapsId
  @OneToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "id")
  private MemoryRecord record;

  @Convert(converter = FloatArrayConverter.class)
  @Column(nullable = false, length = 1 << 20)
  private float[] embedding;

  @Column(nullable = false)
  private int dimensions;
}

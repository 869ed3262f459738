package com.flamingo.ai.memoryvault.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Key/value metadata about the store itself, such as the committed embedding dimension. */
@Entity
@Table(name = "vault_meta")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class VaultMeta {

  public static final String DIMENSIONS_KEY = "dimensions";

  @Id
  @Column(name = "meta_key", length = 64)
  private String key;

  @Column(name = "meta_value", nullable = false)
  private String value;
}

package com.flamingo.ai.redline.service.ir;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Intermediate representation of a document: its blocks, outline and ID mapping.
 *
 * <p>Blocks can be addressed by short sequential ID or by durable ID; {@link #resolve(String)}
 * tries the short form first.
 */
public final class DocumentIr {

  @Getter private final IrMetadata metadata;
  @Getter private final List<Block> blocks;
  @Getter private final List<OutlineEntry> outline;

  /** Durable ID to short sequential ID. */
  @Getter private final Map<String, String> idMapping;

  private final Map<String, Block> bySeqId = new HashMap<>();
  private final Map<String, Block> byId = new HashMap<>();

  public DocumentIr(IrMetadata metadata, List<Block> blocks, List<OutlineEntry> outline) {
    this.metadata = metadata;
    this.blocks = List.copyOf(blocks);
    this.outline = List.copyOf(outline);
    Map<String, String> mapping = new LinkedHashMap<>();
    for (Block block : blocks) {
      mapping.put(block.id(), block.seqId());
      bySeqId.put(block.seqId(), block);
      byId.put(block.id(), block);
    }
    this.idMapping = Collections.unmodifiableMap(mapping);
  }

  /**
   * Finds a block by short or durable ID.
   *
   * @param ref block reference as supplied by a caller
   * @return the block, or empty if nothing matches
   */
  public Optional<Block> resolve(String ref) {
    if (ref == null || ref.isBlank()) {
      return Optional.empty();
    }
    String trimmed = ref.trim();
    Block block = bySeqId.get(trimmed);
    return Optional.ofNullable(block != null ? block : byId.get(trimmed));
  }
}

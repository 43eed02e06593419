package com.github.jscodemod.javascript;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.github.jscodemod.CodemodException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.javascript.rhino.Node;

/**
 * Key level edits of an OBJECTLIT node.
 */
final class ObjectLiterals {

  private ObjectLiterals() {}


  static Set<String> keysOf(Node objectLit) {
    Preconditions.checkArgument(objectLit.isObjectLit());
    Set<String> keys = Sets.newLinkedHashSet();
    for (Node property = objectLit.getFirstChild(); property != null; property = property.getNext()) {
      String key = PropertyEntry.keyOf(property);
      if (key != null) {
        keys.add(key);
      }
    }
    return keys;
  }


  static List<PropertyEntry> parseEntries(Collection<String> names) throws CodemodException {
    ImmutableList.Builder<PropertyEntry> entries = ImmutableList.builder();
    for (String name : names) {
      entries.add(PropertyEntry.parse(name));
    }
    return entries.build();
  }


  /**
   * Appends every entry whose key is not in {@code existingKeys}. When
   * {@code recordAppended} is set an appended key counts as existing for the
   * entries after it, otherwise repeated entries are all appended.
   *
   * @return the number of appended entries.
   */
  static int append(Node objectLit, List<PropertyEntry> entries, Set<String> existingKeys,
      boolean recordAppended) {
    int appended = 0;
    for (PropertyEntry entry : entries) {
      if (existingKeys.contains(entry.getKey())) {
        continue;
      }
      objectLit.addChildToBack(entry.toNode());
      appended++;
      if (recordAppended) {
        existingKeys.add(entry.getKey());
      }
    }
    return appended;
  }


  /**
   * Detaches shorthand and spread entries whose key is in {@code keys}, the
   * remaining entries keep their order.
   *
   * @return the number of removed entries.
   */
  static int remove(Node objectLit, Collection<String> keys) {
    List<Node> targets = Lists.newArrayList();
    for (Node property = objectLit.getFirstChild(); property != null; property = property.getNext()) {
      if (PropertyEntry.isRemovable(property) && keys.contains(PropertyEntry.keyOf(property))) {
        targets.add(property);
      }
    }
    for (Node target : targets) {
      target.detach();
    }
    return targets.size();
  }
}

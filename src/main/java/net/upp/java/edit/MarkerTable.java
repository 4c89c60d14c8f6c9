// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.upp.java.edit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The side table of a document's markers, keyed by the id of the syntax tree each marker belongs
 * to. Markers are created, moved to a new tree with {@link #migrate}, and removed with {@link
 * #destroy}; none of this happens implicitly.
 */
public final class MarkerTable {

  private static final class Entry {
    int treeId;
    int offset;
    @Nullable final Object payload;
    boolean valid = true;

    Entry(int treeId, int offset, @Nullable Object payload) {
      this.treeId = treeId;
      this.offset = offset;
      this.payload = payload;
    }
  }

  private final Map<Marker, Entry> entries = new LinkedHashMap<>();
  private int nextHandle = 1;

  /** Registers a marker at {@code offset} of the tree {@code treeId}. */
  public Marker create(int treeId, int offset, @Nullable Object payload) {
    Preconditions.checkArgument(offset >= 0, "negative marker offset %s", offset);
    Marker m = new Marker(nextHandle++);
    entries.put(m, new Entry(treeId, offset, payload));
    return m;
  }

  private Entry entry(Marker m) {
    Entry e = entries.get(m);
    Preconditions.checkArgument(e != null, "unknown or destroyed marker %s", m);
    return e;
  }

  public boolean contains(Marker m) {
    return entries.containsKey(m);
  }

  public boolean isValid(Marker m) {
    return entry(m).valid;
  }

  /**
   * Returns the current offset of a marker.
   *
   * @throws MarkerInvalidatedException if the marker's position has been deleted
   */
  public int offset(Marker m) {
    Entry e = entry(m);
    if (!e.valid) {
      throw new MarkerInvalidatedException(m, m + " was invalidated by an edit");
    }
    return e.offset;
  }

  @Nullable
  public Object payload(Marker m) {
    return entry(m).payload;
  }

  public int treeId(Marker m) {
    return entry(m).treeId;
  }

  /** Removes a marker. Destroying a marker twice is an error. */
  public void destroy(Marker m) {
    Preconditions.checkArgument(entries.remove(m) != null, "unknown or destroyed marker %s", m);
  }

  /** Moves every marker of tree {@code oldTreeId} to tree {@code newTreeId}. */
  public void migrate(int oldTreeId, int newTreeId) {
    for (Entry e : entries.values()) {
      if (e.treeId == oldTreeId) {
        e.treeId = newTreeId;
      }
    }
  }

  /**
   * Updates the markers of tree {@code treeId} for a splice that replaced {@code deleteCount}
   * chars at {@code offset} by {@code insertLength} chars. Markers inside a non-empty deleted range
   * become invalid; markers at or after its end shift; markers before it, and a marker exactly at
   * the offset of a pure insertion, stay.
   */
  void adjust(int treeId, int offset, int deleteCount, int insertLength) {
    int delta = insertLength - deleteCount;
    int deleteEnd = offset + deleteCount;
    for (Entry e : entries.values()) {
      if (e.treeId != treeId || !e.valid) {
        continue;
      }
      if (deleteCount > 0 && e.offset >= offset && e.offset < deleteEnd) {
        e.valid = false;
      } else if (e.offset >= deleteEnd && !(deleteCount == 0 && e.offset == offset)) {
        e.offset += delta;
      }
    }
  }

  /** Returns the markers of a tree, in creation order. */
  public ImmutableList<Marker> markers(int treeId) {
    ImmutableList.Builder<Marker> result = ImmutableList.builder();
    for (Map.Entry<Marker, Entry> e : entries.entrySet()) {
      if (e.getValue().treeId == treeId) {
        result.add(e.getKey());
      }
    }
    return result.build();
  }

  public int size() {
    return entries.size();
  }
}

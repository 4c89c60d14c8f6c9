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

/**
 * An opaque handle to a logical source position registered in a {@link MarkerTable}. The position
 * itself lives in the table, which keeps it up to date as the document is edited.
 */
public final class Marker {

  private final int handle;

  Marker(int handle) {
    this.handle = handle;
  }

  public int handle() {
    return handle;
  }

  @Override
  public String toString() {
    return "Marker#" + handle;
  }
}

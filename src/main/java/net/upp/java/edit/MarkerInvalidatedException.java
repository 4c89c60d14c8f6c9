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
 * Thrown on an attempt to resolve a marker whose position was deleted by an edit. Such a marker
 * never resolves to a node again.
 */
public final class MarkerInvalidatedException extends IllegalStateException {

  private final Marker marker;

  MarkerInvalidatedException(Marker marker, String message) {
    super(message);
    this.marker = marker;
  }

  public Marker marker() {
    return marker;
  }
}

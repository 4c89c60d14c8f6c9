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

package net.upp.java.expand;

/** Stable codes identifying each kind of diagnostic the expander reports. */
public enum DiagnosticCode {
  UPP001("macro redefined"),
  UPP002("expansion did not reach a fixed point"),
  UPP003("syntax error in expanded output"),
  UPP004("upward navigation from a node view"),
  UPP005("replacement rejected"),
  UPP006("macro error"),
  UPP007("wrong number of macro arguments"),
  UPP008("conflicting or unresolved edit");

  private final String summary;

  DiagnosticCode(String summary) {
    this.summary = summary;
  }

  /** Returns a short description of what the code stands for. */
  public String summary() {
    return summary;
  }
}

/*
 * Copyright 2025 XueFeng Ma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package rendezvous.api;

/**
 * Thrown when more completions are signaled than units of work were registered, which would drive
 * the outstanding-work counter below zero. The rejected update is not applied.
 */
public class NegativeCounterException extends WaitGroupMisuseException {

  private final long rejectedCount;

  public NegativeCounterException(String resourceId, long rejectedCount) {
    super(resourceId, "negative counter " + rejectedCount);
    this.rejectedCount = rejectedCount;
  }

  /**
   * @return The counter value the rejected update would have produced.
   */
  public long getRejectedCount() {
    return rejectedCount;
  }
}

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
 * Thrown from a released waiter that finds its wait group already in use by a new completion
 * cycle. A wait group may only be reused once every waiter of the previous cycle has returned.
 */
public class ConcurrentReuseException extends WaitGroupMisuseException {

  public ConcurrentReuseException(String resourceId) {
    super(resourceId, "reused before previous await has returned");
  }
}

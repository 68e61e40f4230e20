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
 * Thrown when an operation is invoked on a client or resource whose lifecycle no longer permits
 * it, for example starting new work on a closed wait group.
 */
public class RendezvousStateException extends RendezvousException {

  public RendezvousStateException(String message) {
    super(message);
  }
}

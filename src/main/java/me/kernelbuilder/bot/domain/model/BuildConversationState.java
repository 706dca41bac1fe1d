package me.kernelbuilder.bot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Stages of the build configuration dialog, in the order they are visited.
 *
 * <p>
 * Field stages collect one {@link BuildField} each and advance with
 * {@link #next()}. {@link #AWAITING_CONFIRMATION} branches to either
 * {@link #FINISHED} or {@link #CANCELLED}; both are terminal.
 */
public enum BuildConversationState {

    AWAITING_COMPILER(BuildField.COMPILER),
    AWAITING_KERNEL_REPO(BuildField.KERNEL_REPO_URL),
    AWAITING_KERNEL_BRANCH(BuildField.KERNEL_BRANCH),
    AWAITING_CONTAINER(BuildField.CONTAINER_IMAGE),
    AWAITING_NOTES(BuildField.NOTES),
    AWAITING_KSU_MODE(BuildField.KERNEL_SU_MODE),
    AWAITING_CONFIRMATION(null),
    FINISHED(null),
    CANCELLED(null);

    private final BuildField field;

    BuildConversationState(BuildField field) {
        this.field = field;
    }

    /**
     * Field collected in this stage, or {@code null} for non-field stages.
     */
    public BuildField field() {
        return field;
    }

    public boolean isCollectingField() {
        return field != null;
    }

    /**
     * Stage entered after a field answer. Only defined for field stages.
     */
    public BuildConversationState next() {
        return switch (this) {
        case AWAITING_COMPILER -> AWAITING_KERNEL_REPO;
        case AWAITING_KERNEL_REPO -> AWAITING_KERNEL_BRANCH;
        case AWAITING_KERNEL_BRANCH -> AWAITING_CONTAINER;
        case AWAITING_CONTAINER -> AWAITING_NOTES;
        case AWAITING_NOTES -> AWAITING_KSU_MODE;
        case AWAITING_KSU_MODE -> AWAITING_CONFIRMATION;
        default -> throw new IllegalStateException("No field transition from " + this);
        };
    }

    /**
     * Stage entered when the user answers the confirmation prompt.
     */
    public BuildConversationState resolve(ConfirmationChoice choice) {
        if (this != AWAITING_CONFIRMATION) {
            throw new IllegalStateException("Confirmation is not expected in " + this);
        }
        return choice == ConfirmationChoice.CONFIRM ? FINISHED : CANCELLED;
    }
}

package com.workhub.server.validator;

import com.workhub.server.model.InboundFrame;
import com.workhub.server.model.MessageKind;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.UserIdentity;
import org.springframework.stereotype.Component;

@Component
public class FrameValidator {

    private static final int MIN_CONTENT_LENGTH = 1;
    private static final int MAX_CONTENT_LENGTH = 4000;
    private static final int MAX_ASSIGNEES = 100;

    /**
     * @return an error description, or null if the frame is valid for the sender
     */
    public String validate(InboundFrame frame, UserIdentity sender) {
        if (frame == null) {
            return "Frame cannot be null";
        }

        MessageKind kind = frame.getKind();
        if (kind == null) {
            return "kind is required (chat, incident_alert or task_notice)";
        }
        if (!kind.isClientSubmittable()) {
            return "kind " + kind.name().toLowerCase() + " cannot be sent by clients";
        }

        String content = frame.getContent();
        if (content == null || content.trim().isEmpty()) {
            return "content is required";
        }
        if (content.length() < MIN_CONTENT_LENGTH || content.length() > MAX_CONTENT_LENGTH) {
            return "content must be " + MIN_CONTENT_LENGTH + "-" + MAX_CONTENT_LENGTH + " characters";
        }

        switch (kind) {
            case CHAT:
                if (frame.getTo() == null || frame.getTo().trim().isEmpty()) {
                    return "to is required for chat";
                }
                if (frame.getTo().equals(sender.getUserId())) {
                    return "cannot send a chat to yourself";
                }
                return null;
            case TASK_NOTICE:
                if (sender.getRole() != Role.MANAGER) {
                    return "only managers can send task notices";
                }
                if (frame.getAssignees() == null || frame.getAssignees().isEmpty()) {
                    return "assignees are required for task_notice";
                }
                if (frame.getAssignees().size() > MAX_ASSIGNEES) {
                    return "at most " + MAX_ASSIGNEES + " assignees are allowed";
                }
                for (String assignee : frame.getAssignees()) {
                    if (assignee == null || assignee.trim().isEmpty() || RecipientSelector.AGENT_ID.equals(assignee)) {
                        return "invalid assignee: " + assignee;
                    }
                }
                return null;
            case INCIDENT_ALERT:
            default:
                return null;
        }
    }
}

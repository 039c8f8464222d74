package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.exception.BadRequestException;

/**
 * An inbound decision from the notification channel, e.g. a chat button press.
 */
public record UserAction(UserActionType action, String signalId, String actorId) {

    /**
     * Parses chat callback data of the form {@code <action>_<signalId>}. Only the first
     * underscore separates the two, since signal ids contain underscores themselves.
     */
    public static UserAction parse(String callbackData, String actorId) {
        if (callbackData == null) {
            throw new BadRequestException("Callback data is required");
        }
        int separator = callbackData.indexOf('_');
        if (separator <= 0 || separator == callbackData.length() - 1) {
            throw new BadRequestException("Malformed callback data: " + callbackData);
        }
        UserActionType type = UserActionType.fromString(callbackData.substring(0, separator));
        return new UserAction(type, callbackData.substring(separator + 1), actorId);
    }
}

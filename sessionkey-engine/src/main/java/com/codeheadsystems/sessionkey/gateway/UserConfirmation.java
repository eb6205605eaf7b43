package com.codeheadsystems.sessionkey.gateway;

import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionKeyState;

/**
 * Asks the wallet owner to approve an action on a key that requires confirmation.
 */
@FunctionalInterface
public interface UserConfirmation {

  /**
   * Confirmation that declines every request. Used when no interactive channel exists.
   *
   * @return the user confirmation
   */
  static UserConfirmation declineAll() {
    return (state, action) -> false;
  }

  /**
   * Confirm.
   *
   * @param state  the key the action runs under
   * @param action the admitted action
   * @return true if the owner approved
   */
  boolean confirm(SessionKeyState state, ProposedAction action);
}

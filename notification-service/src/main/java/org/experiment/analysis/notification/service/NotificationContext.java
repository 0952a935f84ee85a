package org.experiment.analysis.notification.service;

import lombok.Builder;
import lombok.Value;
import org.experiment.analysis.datamodel.event.EventUser;

/** Who triggered an evaluation and for which organization. */
@Value
@Builder(toBuilder = true)
public class NotificationContext {
  OrganizationSettings organization;
  String userId;
  String email;
  String userName;

  public EventUser toEventUser() {
    return EventUser.builder().id(userId).email(email).name(userName).build();
  }
}

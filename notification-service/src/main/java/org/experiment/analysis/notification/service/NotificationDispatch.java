package org.experiment.analysis.notification.service;

import java.io.IOException;

@FunctionalInterface
public interface NotificationDispatch {
  void dispatch() throws IOException;
}

package com.joshlong.mediaops.notifications;

public interface Notifier {

	void notify(Notification notification);

}

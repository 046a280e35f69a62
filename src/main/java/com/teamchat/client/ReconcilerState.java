package com.teamchat.client;

public enum ReconcilerState {
    IDLE,
    /** 有一条发送在途，此时拒绝再次发送。 */
    SENDING
}

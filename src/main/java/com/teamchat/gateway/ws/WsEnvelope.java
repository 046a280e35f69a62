package com.teamchat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.teamchat.domain.dto.ChatEvent;
import lombok.Data;

/**
 * WS JSON 文本协议的统一外壳。
 *
 * <p>客户端 -&gt; 服务端：PING / SUBSCRIBE / UNSUBSCRIBE / TYPING。</p>
 * <p>服务端 -&gt; 客户端：PONG / READY / SUBSCRIBED / UNSUBSCRIBED / EVENT / ERROR。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WsEnvelope {

    public static final String PING = "PING";
    public static final String PONG = "PONG";
    public static final String SUBSCRIBE = "SUBSCRIBE";
    public static final String UNSUBSCRIBE = "UNSUBSCRIBE";
    public static final String TYPING = "TYPING";
    public static final String READY = "READY";
    public static final String SUBSCRIBED = "SUBSCRIBED";
    public static final String UNSUBSCRIBED = "UNSUBSCRIBED";
    public static final String EVENT = "EVENT";
    public static final String ERROR = "ERROR";

    /** 路由字段。 */
    private String type;

    /** SUBSCRIBE/UNSUBSCRIBE/EVENT：topic 字符串（chat.channel.&lt;id&gt; / chat.user.&lt;ref&gt;）。 */
    private String topic;

    /** TYPING：频道 id。 */
    private Long channelId;

    private Boolean typing;

    /** EVENT 的负载。 */
    private ChatEvent event;

    /** ERROR 的原因（snake_case）。 */
    private String reason;

    private Long ts;

    public static WsEnvelope of(String type) {
        WsEnvelope env = new WsEnvelope();
        env.setType(type);
        env.setTs(System.currentTimeMillis());
        return env;
    }

    public static WsEnvelope event(String topic, ChatEvent event) {
        WsEnvelope env = of(EVENT);
        env.setTopic(topic);
        env.setEvent(event);
        return env;
    }

    public static WsEnvelope error(String reason) {
        WsEnvelope env = of(ERROR);
        env.setReason(reason);
        return env;
    }
}

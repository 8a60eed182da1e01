package cn.bafuka.tablearmor.consistency;

/**
 * 远端失效监听器
 * 收到其他节点的失效消息并在本地应用后回调
 */
public interface InvalidationListener {

    /**
     * 处理失效事件
     *
     * @param event 事件
     */
    void onInvalidation(InvalidationEvent event);
}

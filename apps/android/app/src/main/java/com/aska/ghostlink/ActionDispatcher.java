package com.aska.ghostlink;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * 动作分发器
 *
 * 职责：
 * 1. 统一动作名：tap、action.tap、/action/tap 指向同一个处理器
 * 2. 按名称查找处理器并同步调用
 * 3. 把处理器抛出的所有异常转换为结构化错误，异常不会越过这里
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Dispatcher");

    private static final String PATH_PREFIX = "/action/";
    private static final String DOT_PREFIX = "action.";

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    /**
     * 组装带全部内置动作的分发器
     */
    public static ActionDispatcher create(DeviceAutomation device, ConfigStore config) {
        CommandExecutor executor = new CommandExecutor(device);
        TreeCompactor compactor = new TreeCompactor();
        ActionDispatcher dispatcher = new ActionDispatcher();

        new DeviceActions(executor, config).registerAll(dispatcher);
        new StateQueries(executor, compactor, config).registerAll(dispatcher);

        ElementActions elementActions = new ElementActions(executor, compactor, config);
        elementActions.registerAll(dispatcher);
        new TreeWaiter(executor, config).registerAll(dispatcher);
        log.info("Registered {} actions", dispatcher.handlers.size());
        return dispatcher;
    }

    /**
     * 注册处理器，同名覆盖
     */
    public void register(String name, ActionHandler handler, String... aliases) {
        handlers.put(normalize(name), handler);
        for (String alias : aliases) {
            handlers.put(normalize(alias), handler);
        }
    }

    /**
     * 去掉一个 /action/ 或 action. 前缀，以及开头的斜杠
     */
    public static String normalize(String action) {
        if (action == null) return "";
        String name = action.trim();
        if (name.startsWith(PATH_PREFIX)) {
            name = name.substring(PATH_PREFIX.length());
        } else if (name.startsWith(DOT_PREFIX)) {
            name = name.substring(DOT_PREFIX.length());
        }
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return name;
    }

    public boolean hasAction(String action) {
        return handlers.containsKey(normalize(action));
    }

    public Set<String> actionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    /**
     * 分发一个动作
     *
     * @param params 可为 null，按空对象处理
     * @return 永远不为 null
     */
    public ApiResponse dispatch(String action, JSONObject params) {
        String name = normalize(action);
        ActionHandler handler = handlers.get(name);
        if (handler == null) {
            log.warn("Unknown action: {}", action);
            return ApiResponse.error(ErrorCode.UNKNOWN_ACTION, "Unknown action: " + action);
        }

        JSONObject args = params != null ? params : new JSONObject();
        if (Config.DEBUG_MODE) {
            log.debug("Dispatch {} {}", name, args);
        }

        try {
            ApiResponse response = handler.handle(args);
            return response != null ? response : ApiResponse.failed("Action returned no result: " + name);
        } catch (MissingParameterException e) {
            log.warn("Action {} rejected: {}", name, e.getMessage());
            return ApiResponse.error(ErrorCode.MISSING_PARAMETER, e.getMessage());
        } catch (JSONException | IllegalArgumentException e) {
            log.warn("Action {} got malformed input: {}", name, e.getMessage());
            return ApiResponse.error(ErrorCode.MALFORMED_INPUT, "Invalid parameters: " + e.getMessage());
        } catch (TimeoutException e) {
            log.warn("Action {} timed out", name);
            return ApiResponse.error(ErrorCode.TIMEOUT, "Timed out: " + name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResponse.error(ErrorCode.TIMEOUT, "Interrupted: " + name);
        } catch (Exception e) {
            log.error("Action {} failed", name, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ApiResponse.failed(message);
        }
    }
}

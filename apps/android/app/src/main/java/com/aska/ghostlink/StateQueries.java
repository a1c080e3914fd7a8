package com.aska.ghostlink;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 只读查询：UI 树、手机状态、版本、已安装应用
 */
class StateQueries {

    static final String NO_ACTIVE_WINDOW = "No active window";

    private final CommandExecutor executor;
    private final TreeCompactor compactor;
    private final ConfigStore config;

    StateQueries(CommandExecutor executor, TreeCompactor compactor, ConfigStore config) {
        this.executor = executor;
        this.compactor = compactor;
        this.config = config;
    }

    void registerAll(ActionDispatcher dispatcher) {
        dispatcher.register("ping", params -> ApiResponse.success("pong"));
        dispatcher.register("a11y_tree", this::tree);
        dispatcher.register("a11y_tree_full", this::treeFull);
        dispatcher.register("state", this::state);
        dispatcher.register("state_full", this::stateFull);
        dispatcher.register("phone_state", params -> ApiResponse.success(executor.phoneState()));
        dispatcher.register("version",
            params -> ApiResponse.success(config.getString(Config.KEY_APP_VERSION, "unknown")));
        dispatcher.register("packages", this::packages, "packages.list");
        dispatcher.register("screen.dump", this::screenDump);
    }

    /**
     * filter=false 时不做屏幕可见性过滤
     */
    private Bounds screenFilter(JSONObject params) {
        return Params.getBoolean(params, "filter", true) ? executor.screenBounds() : null;
    }

    ApiResponse tree(JSONObject params) {
        RawNode root = executor.snapshot();
        if (root == null) {
            return ApiResponse.failed(NO_ACTIVE_WINDOW);
        }
        return ApiResponse.success(compactor.compact(root, screenFilter(params)));
    }

    ApiResponse treeFull(JSONObject params) {
        RawNode root = executor.snapshot();
        if (root == null) {
            return ApiResponse.failed(NO_ACTIVE_WINDOW);
        }
        return ApiResponse.success(fullTree(root, screenFilter(params)));
    }

    ApiResponse state(JSONObject params) {
        RawNode root = executor.snapshot();
        if (root == null) {
            return ApiResponse.failed(NO_ACTIVE_WINDOW);
        }
        JSONObject result = new JSONObject();
        result.put("a11y_tree", JsonUtils.toJsonArray(compactor.compact(root, screenFilter(params))));
        result.put("phone_state", phoneStateJson());
        return ApiResponse.success(result);
    }

    ApiResponse stateFull(JSONObject params) {
        RawNode root = executor.snapshot();
        if (root == null) {
            return ApiResponse.failed(NO_ACTIVE_WINDOW);
        }
        Bounds screen = executor.screenBounds();
        boolean filter = Params.getBoolean(params, "filter", true);

        JSONObject result = new JSONObject();
        result.put("a11y_tree", fullTree(root, filter ? screen : null));
        result.put("phone_state", phoneStateJson());
        result.put("device_context", JsonUtils.toJsonObject(new DeviceContext(
            ScreenInfo.of(screen != null ? screen : root.bounds),
            config.getString(Config.KEY_DEVICE_NAME, ""),
            config.getInt(Config.KEY_OVERLAY_OFFSET, 0))));
        return ApiResponse.success(result);
    }

    private static JSONArray fullTree(RawNode root, Bounds screen) {
        JSONArray tree = new JSONArray();
        JSONObject json = TreeSerializer.toJson(root, screen);
        if (json != null) {
            tree.put(json);
        }
        return tree;
    }

    private Object phoneStateJson() {
        PhoneState state = executor.phoneState();
        return state != null ? JsonUtils.toJsonObject(state) : JSONObject.NULL;
    }

    /**
     * type: user / system / all（默认）
     */
    ApiResponse packages(JSONObject params) {
        String type = Params.getString(params, "type", "all").toLowerCase(Locale.ROOT);
        if (!type.equals("all") && !type.equals("user") && !type.equals("system")) {
            throw new IllegalArgumentException("type must be one of user, system, all");
        }

        List<AppPackage> selected = new ArrayList<>();
        for (AppPackage pkg : executor.installedPackages()) {
            if (type.equals("all")
                    || (type.equals("system") && pkg.isSystemApp)
                    || (type.equals("user") && !pkg.isSystemApp)) {
                selected.add(pkg);
            }
        }

        JSONObject result = new JSONObject();
        result.put("count", selected.size());
        result.put("packages", JsonUtils.toJsonArray(selected));
        return ApiResponse.success(result);
    }

    ApiResponse screenDump(JSONObject params) {
        RawNode root = executor.snapshot();
        if (root == null) {
            return ApiResponse.failed(NO_ACTIVE_WINDOW);
        }
        return ApiResponse.success(compactor.render(root, screenFilter(params), executor.phoneState()));
    }
}

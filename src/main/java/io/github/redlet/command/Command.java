package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.kv.StoreException;
import io.github.redlet.resp.RespData;

/**
 * 经过校验的命令，只持有执行需要的参数，不可变。
 *
 * @author zy
 */
public interface Command {

    CommandType getType();

    /**
     * 在store上执行命令
     *
     * @param store 共享的存储
     * @return 响应帧
     * @throws StoreException 存储内部错误
     */
    RespData execute(Store store) throws StoreException;
}

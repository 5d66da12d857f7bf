package io.github.redlet.kv;

import java.util.List;
import java.util.SortedMap;

import io.github.redlet.resp.RespData;

/**
 * 内存中的三类key空间：普通值、hash和set，相互独立。key在第一次写入时创建，不会被删除。
 * 所有方法都可以被多个连接并发调用。
 *
 * @author zy
 */
public interface Store {

    /**
     * @return 值，不存在返回null
     */
    RespData get(String key);

    void set(String key, RespData value);

    /**
     * @return hash中field的值，key或field不存在返回null
     */
    RespData hget(String key, String field);

    void hset(String key, String field, RespData value);

    /**
     * @return 按field排序的快照，key不存在返回空map
     */
    SortedMap<String, RespData> hgetAll(String key);

    /**
     * 把不在set中的成员按顺序追加到末尾。两个值编码后的字节相同才是同一个成员。
     *
     * @return 新加入的成员个数
     * @throws StoreException 等待key的锁时被中断
     */
    int sadd(String key, List<RespData> members) throws StoreException;

    boolean sismember(String key, RespData member) throws StoreException;

    /**
     * @return 按插入顺序排列的成员快照，key不存在返回空列表
     */
    List<RespData> smembers(String key) throws StoreException;
}

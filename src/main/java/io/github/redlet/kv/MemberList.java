package io.github.redlet.kv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.collect.ImmutableList;
import io.github.redlet.resp.RespData;

/**
 * 一个set类型key的成员列表，按插入顺序保存，由自己的锁保护。
 * <p>
 * 帧中有double，没有全序，所以不用hash或者有序结构去重，而是比较编码后的字节，线性扫描。
 * 帧是不可变的，每个成员的编码在加入时算好保存下来。
 *
 * @author zy
 */
class MemberList {
    private final ReentrantLock  lock      = new ReentrantLock();
    private final List<RespData> members   = new ArrayList<>();
    private final List<byte[]>   encodings = new ArrayList<>();

    /**
     * @return 新加入的个数，同一批中重复的值只算一次
     */
    int addAll(List<RespData> candidates) throws StoreException {
        lock();
        try {
            int added = 0;
            for (RespData candidate : candidates) {
                byte[] encoding = candidate.toBytes();
                if (indexOf(encoding) < 0) {
                    members.add(candidate);
                    encodings.add(encoding);
                    added++;
                }
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    boolean contains(RespData member) throws StoreException {
        byte[] encoding = member.toBytes();
        lock();
        try {
            return indexOf(encoding) >= 0;
        } finally {
            lock.unlock();
        }
    }

    List<RespData> snapshot() throws StoreException {
        lock();
        try {
            return ImmutableList.copyOf(members);
        } finally {
            lock.unlock();
        }
    }

    private int indexOf(byte[] encoding) {
        for (int i = 0; i < encodings.size(); i++) {
            if (Arrays.equals(encodings.get(i), encoding)) {
                return i;
            }
        }
        return -1;
    }

    private void lock() throws StoreException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted while waiting for set lock", e);
        }
    }
}

package com.litesql.backend.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * 每连接一个线程的阻塞式 socket 服务器。
 * <p>
 * 并发连接数由线程池上限控制：池满时新连接交给 {@link #reject(Socket)} 回一行错误后关闭。
 * 子类只需实现单个连接的处理逻辑。
 */
public abstract class SocketServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketServer.class);

    /** 池满时等待空闲工作线程的时长 */
    private static final long HANDOFF_WAIT_MS = 500L;

    private final String name;
    private final int port;
    private final int maxClients;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private ServerSocket serverSocket;
    private ThreadPoolExecutor tpe;
    private Thread acceptThread;

    protected SocketServer(String name, int port, int maxClients) {
        this.name = name;
        this.port = port;
        this.maxClients = maxClients;
    }

    /**
     * 绑定端口并在后台线程开始 accept。端口为 0 时由系统分配，可通过 {@link #getLocalPort()} 获取。
     */
    public void start() throws IOException {
        if(!running.compareAndSet(false, true)) {
            return;
        }
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(port), maxClients);

        // 线程池：同步移交，不排队；满了先等一个刚结束的工作线程来接手，等不到才拒绝
        tpe = new ThreadPoolExecutor(
            maxClients,
            maxClients,
            30L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            new ThreadFactoryBuilder().setNameFormat(name + "-client-%d").setDaemon(true).build(),
            SocketServer::handOffOrReject
        );
        tpe.allowCoreThreadTimeOut(true);

        acceptThread = new ThreadFactoryBuilder().setNameFormat(name + "-accept").setDaemon(true).build()
                .newThread(this::acceptLoop);
        acceptThread.start();
        LOGGER.info("{} server listening on port {}", name, getLocalPort());
    }

    public void stop() {
        if(!running.compareAndSet(true, false)) {
            return;
        }
        try {
            if(serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            LOGGER.warn("{} server socket close failed: {}", name, e.getMessage());
        }
        // 阻塞在 read 上的连接线程只能靠关闭 socket 唤醒
        for (Socket socket : clients) {
            closeSocket(socket);
        }
        if(tpe != null) {
            tpe.shutdown();
            try {
                if(!tpe.awaitTermination(5, TimeUnit.SECONDS)) {
                    tpe.shutdownNow();
                }
            } catch (InterruptedException ie) {
                tpe.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("{} server stopped", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getLocalPort() {
        return serverSocket == null ? port : serverSocket.getLocalPort();
    }

    public int getMaxClients() {
        return maxClients;
    }

    /**
     * 处理一个已接受的连接，返回后连接会被关闭。
     */
    protected abstract void handle(Socket socket, String remote) throws IOException;

    /**
     * 连接数已满时调用，通常回一行错误信息。
     */
    protected abstract void reject(Socket socket) throws IOException;

    /**
     * 断开的客户端要等连接线程读到 EOF 才会归还线程，紧接着到来的新连接在这段窗口里等一会儿。
     */
    private static void handOffOrReject(Runnable task, ThreadPoolExecutor executor) {
        if(!executor.isShutdown()) {
            try {
                if(executor.getQueue().offer(task, HANDOFF_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        throw new RejectedExecutionException("no free client worker");
    }

    private void acceptLoop() {
        while(running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if(running.get() && !serverSocket.isClosed()) {
                    LOGGER.warn("{} accept failed: {}", name, e.getMessage());
                    continue;
                }
                break;
            } catch (IOException e) {
                LOGGER.warn("{} accept failed: {}", name, e.getMessage());
                continue;
            }
            try {
                tpe.execute(() -> serve(socket));
            } catch (RejectedExecutionException e) {
                LOGGER.warn("{} rejecting {}: max clients ({}) reached", name, remoteOf(socket), maxClients);
                try {
                    reject(socket);
                } catch (IOException ioe) {
                    LOGGER.debug("reject write failed: {}", ioe.getMessage());
                } finally {
                    closeSocket(socket);
                }
            }
        }
    }

    private void serve(Socket socket) {
        String remote = remoteOf(socket);
        clients.add(socket);
        LOGGER.info("{} client connected: {}", name, remote);
        try {
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            handle(socket, remote);
        } catch (IOException e) {
            if(running.get()) {
                LOGGER.warn("{} connection {} failed: {}", name, remote, e.getMessage());
            }
        } catch (RuntimeException e) {
            LOGGER.error("{} connection {} crashed", name, remote, e);
        } finally {
            clients.remove(socket);
            closeSocket(socket);
            LOGGER.info("{} client disconnected: {}", name, remote);
        }
    }

    private static String remoteOf(Socket socket) {
        InetSocketAddress address = (InetSocketAddress) socket.getRemoteSocketAddress();
        if(address == null) {
            return "unknown";
        }
        return address.getAddress().getHostAddress() + ":" + address.getPort();
    }

    private void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("{} socket close failed: {}", name, e.getMessage());
        }
    }
}
